package me.golemcore.reminder.adapter.outbound.alert;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.AlertPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.AWTException;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.GraphicsEnvironment;
import java.awt.Image;
import java.awt.SystemTray;
import java.awt.TrayIcon;
import java.awt.image.BufferedImage;

/**
 * {@link AlertPort} backed by a desktop tray icon balloon. The icon is
 * installed on the first alert. Unavailable on headless hosts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SystemTrayAlertAdapter implements AlertPort {

    private static final int ICON_SIZE = 16;

    private final BotProperties properties;

    private TrayIcon trayIcon;

    @Override
    public boolean isAvailable() {
        return properties.getAlerts().isTrayEnabled()
                && !GraphicsEnvironment.isHeadless()
                && SystemTray.isSupported();
    }

    @Override
    public void showAlert(String title, String body) {
        if (!isAvailable()) {
            throw new IllegalStateException("System tray is not available");
        }
        ensureInstalled().displayMessage(title, body, TrayIcon.MessageType.INFO);
        log.debug("[Tray] Alert shown: {}", title);
    }

    @PreDestroy
    public synchronized void remove() {
        if (trayIcon != null) {
            SystemTray.getSystemTray().remove(trayIcon);
            trayIcon = null;
        }
    }

    private synchronized TrayIcon ensureInstalled() {
        if (trayIcon != null) {
            return trayIcon;
        }
        TrayIcon icon = new TrayIcon(buildImage(), properties.getAlerts().getTrayTooltip());
        icon.setImageAutoSize(true);
        try {
            SystemTray.getSystemTray().add(icon);
        } catch (AWTException e) {
            throw new IllegalStateException("Failed to install tray icon", e);
        }
        trayIcon = icon;
        log.info("[Tray] Tray icon installed");
        return icon;
    }

    private Image buildImage() {
        BufferedImage image = new BufferedImage(ICON_SIZE, ICON_SIZE, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        g.setColor(new Color(0xFF9800));
        g.fillOval(0, 0, ICON_SIZE - 1, ICON_SIZE - 1);
        g.setColor(Color.WHITE);
        g.drawLine(8, 3, 8, 8);
        g.drawLine(8, 8, 11, 10);
        g.dispose();
        return image;
    }
}

package me.golemcore.reminder.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the reminder engine.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@code storage} - local storage base path</li>
 * <li>{@code http} - OkHttp client timeouts and pool</li>
 * <li>{@code voice} - ElevenLabs text-to-speech for spoken reminders</li>
 * <li>{@code alerts} - desktop tray alerts</li>
 * <li>{@code reminders} - parser zone, reply language, polling cadence, dedup
 * window, retention</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private VoiceProperties voice = new VoiceProperties();
    private AlertProperties alerts = new AlertProperties();
    private ReminderProperties reminders = new ReminderProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/workspace";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== VOICE ====================

    @Data
    public static class VoiceProperties {
        private boolean enabled = false;
        private String apiKey = "";
        private String voiceId = "21m00Tcm4TlvDq8ikWAM";
        private String ttsModelId = "eleven_multilingual_v2";
        private float speed = 1.0f;
        private int sampleRate = 22050;
    }

    // ==================== ALERTS ====================

    @Data
    public static class AlertProperties {
        private boolean trayEnabled = true;
        private String trayTooltip = "GolemCore Reminders";
    }

    // ==================== REMINDERS ====================

    @Data
    public static class ReminderProperties {
        private String directory = "reminders";
        private String file = "reminders.json";
        private String zone = "UTC";
        private String language = "en";
        private boolean schedulerEnabled = true;
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration failureBackoff = Duration.ofSeconds(60);
        private Duration dedupWindow = Duration.ofMinutes(5);
        private int completedRetention = 200;
        private int defaultListLimit = 10;
        private int maxListLimit = 100;
        private WatcherProperties watcher = new WatcherProperties();
    }

    @Data
    public static class WatcherProperties {
        private boolean enabled = false;
        private Duration pollInterval = Duration.ofSeconds(15);
    }
}

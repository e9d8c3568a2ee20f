package me.golemcore.reminder.domain.service;

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

import me.golemcore.reminder.domain.model.DispatchOutcome;
import me.golemcore.reminder.domain.model.Reminder;
import me.golemcore.reminder.infrastructure.i18n.MessageService;
import me.golemcore.reminder.port.outbound.AlertPort;
import me.golemcore.reminder.port.outbound.SpeechPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers a due reminder to the alert and speech sinks.
 *
 * <p>
 * Each reminder is delivered at most once per dedup window across every caller
 * sharing the {@link NotificationLedger}. Sink failures are logged and reported
 * through {@link DispatchOutcome}; they never propagate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderDispatcher {

    private static final long SPEECH_TIMEOUT_SECONDS = 60;

    private final AlertPort alertPort;
    private final SpeechPort speechPort;
    private final NotificationLedger ledger;
    private final MessageService messageService;
    private final Clock clock;

    public DispatchOutcome dispatch(Reminder reminder) {
        if (!ledger.tryAcquire(reminder.getId(), clock.instant())) {
            log.debug("[Dispatcher] Reminder {} already notified recently, suppressed", reminder.getId());
            return DispatchOutcome.SUPPRESSED;
        }

        boolean alerted = showAlert(messageService.getMessage("reminder.alert.title"), reminder.getText());
        boolean spoken = speak(messageService.getMessage("reminder.speech", reminder.getText()));

        if (alerted || spoken) {
            log.info("[Dispatcher] Delivered reminder {} (alert={}, speech={})", reminder.getId(), alerted, spoken);
            return DispatchOutcome.DELIVERED;
        }
        log.warn("[Dispatcher] Reminder {} could not be delivered by any sink", reminder.getId());
        return DispatchOutcome.FAILED;
    }

    /**
     * Shows a system warning through the alert sink only, without dedup.
     */
    public void notifyWarning(String title, String body) {
        if (!showAlert(title, body)) {
            log.warn("[Dispatcher] System warning not shown: {} - {}", title, body);
        }
    }

    private boolean showAlert(String title, String body) {
        if (!alertPort.isAvailable()) {
            return false;
        }
        try {
            alertPort.showAlert(title, body);
            return true;
        } catch (RuntimeException e) {
            log.warn("[Dispatcher] Alert failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean speak(String text) {
        if (!speechPort.isAvailable()) {
            return false;
        }
        try {
            speechPort.speak(text).get(SPEECH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Dispatcher] Speech interrupted");
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Dispatcher] Speech failed: {}", e.getMessage());
            return false;
        }
    }
}

package me.golemcore.reminder.schedule;

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
import me.golemcore.reminder.domain.service.ReminderDispatcher;
import me.golemcore.reminder.domain.service.ReminderService;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Tray-side observer that polls for due reminders independently of
 * {@link ReminderScheduler}. Only notifies; lifecycle transitions stay with the
 * scheduler, and the shared ledger keeps both from alerting twice.
 */
@Component
@Slf4j
public class ReminderWatcher {

    private final ReminderService reminderService;
    private final ReminderDispatcher dispatcher;
    private final BotProperties.WatcherProperties settings;

    private ScheduledExecutorService executor;

    public ReminderWatcher(ReminderService reminderService, ReminderDispatcher dispatcher,
            BotProperties properties) {
        this.reminderService = reminderService;
        this.dispatcher = dispatcher;
        this.settings = properties.getReminders().getWatcher();
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.debug("[ReminderWatcher] Watcher disabled");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reminder-watcher");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = settings.getPollInterval().toMillis();
        executor.scheduleWithFixedDelay(this::poll, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[ReminderWatcher] Started with poll interval: {}", settings.getPollInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Notifies every reminder due now.
     *
     * @return number of reminders actually delivered
     */
    int poll() {
        int delivered = 0;
        try {
            for (Reminder reminder : reminderService.dueNow()) {
                if (dispatcher.dispatch(reminder) == DispatchOutcome.DELIVERED) {
                    delivered++;
                }
            }
        } catch (RuntimeException e) { // NOSONAR - keep polling
            log.error("[ReminderWatcher] Poll failed: {}", e.getMessage(), e);
        }
        return delivered;
    }
}

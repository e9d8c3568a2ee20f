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
import me.golemcore.reminder.domain.service.NotificationLedger;
import me.golemcore.reminder.domain.service.ReminderDispatcher;
import me.golemcore.reminder.domain.service.ReminderPersistenceException;
import me.golemcore.reminder.domain.service.ReminderStore;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.infrastructure.i18n.MessageService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that fires due reminders.
 *
 * <p>
 * Each iteration:
 * <ol>
 * <li>Reads the reminders due now from {@link ReminderStore}</li>
 * <li>Dispatches each one through {@link ReminderDispatcher}</li>
 * <li>Records the firings in one store write: recurring reminders move to their
 * next occurrence, one-shot reminders complete</li>
 * </ol>
 *
 * <p>
 * Iterations start on a fixed deadline every {@code bot.reminders.poll-interval}
 * on a single thread, so they never overlap. A failed iteration is logged and
 * the next one is delayed by {@code bot.reminders.failure-backoff}.
 * {@link #stop()} waits for an in-flight iteration and guarantees that none
 * starts afterwards.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ReminderScheduler {

    public enum State {
        STOPPED, RUNNING
    }

    private final ReminderStore store;
    private final ReminderDispatcher dispatcher;
    private final NotificationLedger ledger;
    private final MessageService messageService;
    private final Clock clock;
    private final BotProperties.ReminderProperties settings;
    private final Object lifecycleLock = new Object();

    private State state = State.STOPPED;
    private ScheduledThreadPoolExecutor executor;
    private volatile boolean persistenceAlertShown;

    public ReminderScheduler(ReminderStore store, ReminderDispatcher dispatcher, NotificationLedger ledger,
            MessageService messageService, Clock clock, BotProperties properties) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.ledger = ledger;
        this.messageService = messageService;
        this.clock = clock;
        this.settings = properties.getReminders();
    }

    @PostConstruct
    public void init() {
        if (!settings.isSchedulerEnabled()) {
            log.info("[ReminderScheduler] Scheduler disabled");
            return;
        }
        start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (state == State.RUNNING) {
                return;
            }
            executor = new ScheduledThreadPoolExecutor(1, r -> {
                Thread t = new Thread(r, "reminder-scheduler");
                t.setDaemon(true);
                return t;
            });
            executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            state = State.RUNNING;
            ScheduledThreadPoolExecutor owner = executor;
            owner.schedule(() -> tick(owner), 0, TimeUnit.MILLISECONDS);
        }
        log.info("[ReminderScheduler] Started with poll interval: {}", settings.getPollInterval());
    }

    /**
     * Stops the loop and blocks until the in-flight iteration, if any, has
     * finished dispatching and persisting.
     */
    public void stop() {
        ScheduledThreadPoolExecutor stopping;
        synchronized (lifecycleLock) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.STOPPED;
            stopping = executor;
            executor = null;
            stopping.shutdown();
        }

        try {
            while (!stopping.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("[ReminderScheduler] Waiting for in-flight iteration");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopping.shutdownNow();
        }
        log.info("[ReminderScheduler] Stopped");
    }

    public State getState() {
        synchronized (lifecycleLock) {
            return state;
        }
    }

    public boolean isRunning() {
        return getState() == State.RUNNING;
    }

    /**
     * Runs one iteration and queues the next one on {@code owner}. A tick
     * left over from an executor that was stopped never reschedules itself.
     */
    void tick(ScheduledThreadPoolExecutor owner) {
        long startedAt = System.nanoTime();
        Duration nextDelay = settings.getFailureBackoff();
        try {
            runIteration();
            nextDelay = settings.getPollInterval().minusNanos(System.nanoTime() - startedAt);
        } catch (Exception e) { // NOSONAR - the loop must survive any iteration failure
            log.error("[ReminderScheduler] Iteration failed, backing off for {}: {}",
                    settings.getFailureBackoff(), e.getMessage(), e);
        } finally {
            scheduleNext(owner, nextDelay);
        }
    }

    /**
     * One poll: dispatch everything due and record the firings.
     *
     * @return number of reminders fired
     */
    int runIteration() {
        Instant now = clock.instant();
        ledger.purgeExpired(now);

        List<Reminder> due = store.due(now);
        if (due.isEmpty()) {
            return 0;
        }
        log.info("[ReminderScheduler] {} reminders due", due.size());

        for (Reminder reminder : due) {
            DispatchOutcome outcome = dispatcher.dispatch(reminder);
            log.debug("[ReminderScheduler] Reminder {} dispatch outcome: {}", reminder.getId(), outcome);
        }

        List<String> ids = due.stream().map(Reminder::getId).toList();
        try {
            store.recordFirings(ids, now);
            persistenceAlertShown = false;
        } catch (ReminderPersistenceException e) {
            if (!persistenceAlertShown) {
                persistenceAlertShown = true;
                dispatcher.notifyWarning(messageService.getMessage("reminder.persistence.title"),
                        messageService.getMessage("reminder.persistence.body"));
            }
            throw e;
        }
        return due.size();
    }

    private void scheduleNext(ScheduledThreadPoolExecutor owner, Duration delay) {
        synchronized (lifecycleLock) {
            if (state != State.RUNNING || executor != owner) {
                return;
            }
            long delayMillis = Math.max(0, delay.toMillis());
            owner.schedule(() -> tick(owner), delayMillis, TimeUnit.MILLISECONDS);
        }
    }
}

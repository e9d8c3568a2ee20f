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

import me.golemcore.reminder.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Records when each reminder was last notified so that every observer sharing
 * this ledger suppresses repeats inside the dedup window.
 */
@Component
public class NotificationLedger {

    private final Map<String, Instant> lastNotified = new ConcurrentHashMap<>();
    private final Duration window;

    public NotificationLedger(BotProperties properties) {
        this.window = properties.getReminders().getDedupWindow();
    }

    /**
     * Atomically checks and records a notification.
     *
     * @return true if the caller may notify, false if the reminder was notified
     *         less than one window ago
     */
    public boolean tryAcquire(String reminderId, Instant now) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        lastNotified.compute(reminderId, (id, previous) -> {
            if (previous != null && now.isBefore(previous.plus(window))) {
                return previous;
            }
            acquired.set(true);
            return now;
        });
        return acquired.get();
    }

    public void forget(String reminderId) {
        lastNotified.remove(reminderId);
    }

    /**
     * Drops entries whose window has passed.
     */
    public void purgeExpired(Instant now) {
        lastNotified.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().plus(window)));
    }

    int size() {
        return lastNotified.size();
    }
}

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

import java.time.Instant;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues reminder ids derived from the creation epoch-second. Ids are strictly
 * increasing: two reminders created within the same second get consecutive
 * values, and a clock stepping backwards never produces a repeat.
 */
class ReminderIdGenerator {

    private final AtomicLong lastIssued = new AtomicLong(Long.MIN_VALUE);

    String next(Instant createdAt) {
        long candidate = createdAt.getEpochSecond();
        long issued = lastIssued.accumulateAndGet(candidate, (last, now) -> Math.max(now, last + 1));
        return Long.toString(issued);
    }

    /**
     * Advances past every numeric id already in use, so ids stay unique across
     * restarts.
     */
    void seed(Collection<String> existingIds) {
        for (String id : existingIds) {
            try {
                long value = Long.parseLong(id);
                lastIssued.accumulateAndGet(value, Math::max);
            } catch (NumberFormatException ignored) {
                // non-numeric ids cannot collide with generated ones
            }
        }
    }
}

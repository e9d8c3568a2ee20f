package me.golemcore.reminder.domain.model;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user reminder. Reminders are persisted in {@code reminders/reminders.json}
 * keyed by id and owned by the reminder store, which hands out copies.
 *
 * <p>
 * Lifecycle: pending until due, then either completed (one-shot) or moved to
 * the next occurrence (recurring).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Reminder {

    @JsonProperty("id")
    private String id;

    @JsonProperty("text")
    private String text;

    @JsonProperty("due_time")
    private Instant dueTime;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("completed")
    private boolean completed;

    @JsonProperty("recurring")
    private boolean recurring;

    @JsonProperty("recurring_interval")
    private Recurrence recurringInterval;

    @JsonProperty("last_triggered")
    private Instant lastTriggered;

    /**
     * Whether this reminder should fire at {@code now}.
     */
    public boolean isDue(Instant now) {
        return !completed && dueTime != null && !dueTime.isAfter(now);
    }

    /**
     * Completes a one-shot reminder. A second call is a no-op and keeps the first
     * trigger time.
     *
     * @return true if the state changed
     */
    public boolean markCompleted(Instant triggeredAt) {
        if (completed) {
            return false;
        }
        completed = true;
        lastTriggered = triggeredAt;
        return true;
    }

    /**
     * Moves a recurring reminder to its next occurrence, one interval after the
     * current due time.
     *
     * @return false if this reminder does not recur
     */
    public boolean reschedule(Instant triggeredAt) {
        if (!recurring || recurringInterval == null) {
            return false;
        }
        lastTriggered = triggeredAt;
        dueTime = recurringInterval.advance(dueTime);
        completed = false;
        return true;
    }

    public Reminder copy() {
        return toBuilder().build();
    }
}

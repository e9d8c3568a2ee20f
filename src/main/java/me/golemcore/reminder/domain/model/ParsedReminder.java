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

import java.time.Instant;

/**
 * Structured result of parsing a free-text reminder request.
 *
 * @param text
 *            reminder content without trigger phrases or time expressions
 * @param dueTime
 *            absolute due instant
 * @param recurrence
 *            recurrence interval, or null for a one-shot reminder
 */
public record ParsedReminder(String text, Instant dueTime, Recurrence recurrence) {

    public boolean recurring() {
        return recurrence != null;
    }
}

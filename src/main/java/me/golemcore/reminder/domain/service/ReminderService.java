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

import me.golemcore.reminder.domain.model.ParsedReminder;
import me.golemcore.reminder.domain.model.Recurrence;
import me.golemcore.reminder.domain.model.Reminder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for dialogue commands and the dashboard. Creates reminders from
 * free text or structured fields and exposes listing and cancellation.
 *
 * <p>
 * Mutating operations propagate {@link ReminderPersistenceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderService {

    private final ReminderTextParser parser;
    private final ReminderStore store;
    private final NotificationLedger ledger;
    private final Clock clock;

    /**
     * Parses and stores a free-text request.
     *
     * @return the stored reminder, or empty if no reminder text could be
     *         extracted
     */
    public Optional<Reminder> addFromText(String rawText) {
        return addFromText(rawText, clock.instant());
    }

    public Optional<Reminder> addFromText(String rawText, Instant now) {
        Optional<ParsedReminder> parsed = parser.parse(rawText, now);
        if (parsed.isEmpty()) {
            log.debug("[Reminders] Could not parse reminder from: {}", rawText);
            return Optional.empty();
        }
        ParsedReminder reminder = parsed.get();
        return Optional.of(store(reminder.text(), reminder.dueTime(), reminder.recurrence(), now));
    }

    /**
     * Stores a reminder from explicit fields. Past due times are accepted and
     * fire on the next scheduler tick.
     *
     * @param recurrence
     *            interval, or null for a one-shot reminder
     */
    public Reminder addStructured(String text, Instant dueTime, Recurrence recurrence) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Reminder text must not be blank");
        }
        if (dueTime == null) {
            throw new IllegalArgumentException("Reminder due time is required");
        }
        return store(text.strip(), dueTime, recurrence, clock.instant());
    }

    public boolean cancel(String id) {
        boolean removed = store.remove(id);
        if (removed) {
            ledger.forget(id);
        }
        return removed;
    }

    public boolean markDone(String id) {
        return store.markCompleted(id);
    }

    public Optional<Reminder> find(String id) {
        return store.get(id);
    }

    public List<Reminder> upcoming(int limit) {
        return store.upcoming(limit);
    }

    public List<Reminder> dueNow() {
        return store.due(clock.instant());
    }

    private Reminder store(String text, Instant dueTime, Recurrence recurrence, Instant createdAt) {
        Reminder reminder = Reminder.builder()
                .text(text)
                .dueTime(dueTime)
                .createdAt(createdAt)
                .recurring(recurrence != null)
                .recurringInterval(recurrence)
                .build();
        String id = store.add(reminder);
        reminder.setId(id);
        return reminder;
    }
}

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

import me.golemcore.reminder.domain.model.Reminder;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single owner of reminder state. Reminders are kept in memory and mirrored to
 * {@code reminders/reminders.json} via {@link StoragePort} after every
 * mutation.
 *
 * <p>
 * Every mutation and every due/upcoming scan holds the store lock. Mutations
 * are applied to a copy of the map, which replaces the live map only after the
 * snapshot was written, so a failed write leaves memory untouched. Callers
 * always receive copies of the stored records.
 */
@Service
@Slf4j
public class ReminderStore {

    private static final TypeReference<LinkedHashMap<String, JsonNode>> ENTRY_MAP_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties.ReminderProperties settings;
    private final Clock clock;
    private final ReminderIdGenerator idGenerator = new ReminderIdGenerator();
    private final Object lock = new Object();

    private Map<String, Reminder> reminders = new LinkedHashMap<>();
    private volatile boolean persistenceFailing;

    public ReminderStore(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.settings = properties.getReminders();
        this.clock = clock;
    }

    /**
     * Loads the persisted snapshot. A missing file yields an empty store; an
     * unreadable or malformed file is logged and also yields an empty store.
     */
    @PostConstruct
    public void load() {
        Map<String, Reminder> loaded = new LinkedHashMap<>();
        try {
            String json = storagePort.getText(settings.getDirectory(), settings.getFile()).join();
            if (json != null && !json.isBlank()) {
                Map<String, JsonNode> entries = objectMapper.readValue(json, ENTRY_MAP_TYPE);
                if (entries != null) {
                    entries.forEach((key, entry) -> acceptLoaded(loaded, key, entry));
                }
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - corrupt snapshot resets the store
            log.warn("[Reminders] Stored reminders unreadable, starting empty: {}", e.getMessage());
            loaded.clear();
        }

        synchronized (lock) {
            reminders = loaded;
            idGenerator.seed(loaded.keySet());
        }
        log.info("[Reminders] Loaded {} reminders", loaded.size());
    }

    /**
     * Inserts a reminder under a newly assigned id and persists.
     *
     * @return the assigned id
     * @throws IllegalArgumentException
     *             if text or due time is missing, or the recurring flag and
     *             interval disagree
     * @throws ReminderPersistenceException
     *             if the snapshot could not be written
     */
    public String add(Reminder candidate) {
        Reminder reminder = candidate.copy();
        validate(reminder);

        synchronized (lock) {
            if (reminder.getCreatedAt() == null) {
                reminder.setCreatedAt(clock.instant());
            }
            String id = idGenerator.next(reminder.getCreatedAt());
            reminder.setId(id);

            Map<String, Reminder> next = new LinkedHashMap<>(reminders);
            next.put(id, reminder);
            commit(next);
            log.info("[Reminders] Added reminder {} due {}", id, reminder.getDueTime());
            return id;
        }
    }

    /**
     * Deletes a reminder.
     *
     * @return true if the reminder existed
     */
    public boolean remove(String id) {
        synchronized (lock) {
            if (!reminders.containsKey(id)) {
                return false;
            }
            Map<String, Reminder> next = new LinkedHashMap<>(reminders);
            next.remove(id);
            commit(next);
            log.info("[Reminders] Removed reminder {}", id);
            return true;
        }
    }

    /**
     * Completes a reminder. Completing an already completed reminder changes
     * nothing and writes nothing.
     *
     * @return true if the reminder exists
     */
    public boolean markCompleted(String id) {
        synchronized (lock) {
            Reminder current = reminders.get(id);
            if (current == null) {
                return false;
            }
            if (current.isCompleted()) {
                return true;
            }
            Reminder updated = current.copy();
            updated.markCompleted(clock.instant());

            Map<String, Reminder> next = new LinkedHashMap<>(reminders);
            next.put(id, updated);
            commit(next);
            return true;
        }
    }

    /**
     * Applies the fired transition to each reminder that is still pending and
     * due at {@code firedAt}: recurring reminders move to their next occurrence,
     * others complete. Writes one snapshot for the whole batch.
     *
     * @return copies of the reminders that were transitioned
     */
    public List<Reminder> recordFirings(Collection<String> ids, Instant firedAt) {
        synchronized (lock) {
            Map<String, Reminder> next = new LinkedHashMap<>(reminders);
            List<Reminder> applied = new ArrayList<>();
            for (String id : ids) {
                Reminder current = next.get(id);
                if (current == null || !current.isDue(firedAt)) {
                    continue;
                }
                Reminder updated = current.copy();
                if (updated.isRecurring()) {
                    updated.reschedule(firedAt);
                } else {
                    updated.markCompleted(firedAt);
                }
                next.put(id, updated);
                applied.add(updated.copy());
            }

            if (!applied.isEmpty()) {
                commit(next);
            }
            return applied;
        }
    }

    public Optional<Reminder> get(String id) {
        synchronized (lock) {
            return Optional.ofNullable(reminders.get(id)).map(Reminder::copy);
        }
    }

    /**
     * Pending reminders ordered by ascending due time.
     */
    public List<Reminder> upcoming(int limit) {
        synchronized (lock) {
            return reminders.values().stream()
                    .filter(reminder -> !reminder.isCompleted())
                    .sorted(Comparator.comparing(Reminder::getDueTime))
                    .limit(Math.max(0, limit))
                    .map(Reminder::copy)
                    .toList();
        }
    }

    /**
     * Pending reminders whose due time is at or before {@code now}.
     */
    public List<Reminder> due(Instant now) {
        synchronized (lock) {
            return reminders.values().stream()
                    .filter(reminder -> reminder.isDue(now))
                    .map(Reminder::copy)
                    .toList();
        }
    }

    public List<Reminder> all() {
        synchronized (lock) {
            return reminders.values().stream()
                    .map(Reminder::copy)
                    .toList();
        }
    }

    /**
     * Whether the most recent write failed.
     */
    public boolean hasPersistenceWarning() {
        return persistenceFailing;
    }

    static void validate(Reminder reminder) {
        if (reminder.getText() == null || reminder.getText().isBlank()) {
            throw new IllegalArgumentException("Reminder text is required");
        }
        if (reminder.getDueTime() == null) {
            throw new IllegalArgumentException("Reminder due time is required");
        }
        if (reminder.isRecurring() != (reminder.getRecurringInterval() != null)) {
            throw new IllegalArgumentException("Recurring reminders require an interval, one-shot reminders must not have one");
        }
    }

    private void acceptLoaded(Map<String, Reminder> loaded, String key, JsonNode entry) {
        if (entry == null || entry.isNull()) {
            return;
        }
        try {
            Reminder reminder = objectMapper.treeToValue(entry, Reminder.class);
            reminder.setId(key);
            validate(reminder);
            loaded.put(key, reminder);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[Reminders] Skipping stored reminder {}: {}", key, e.getMessage());
        }
    }

    private void commit(Map<String, Reminder> next) {
        pruneCompleted(next);
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(next);
            storagePort.putTextAtomic(settings.getDirectory(), settings.getFile(), json, true).join();
        } catch (IOException | RuntimeException e) { // NOSONAR - any write failure must leave memory untouched
            if (!persistenceFailing) {
                persistenceFailing = true;
                log.error("[Reminders] Failed to save reminders", e);
            } else {
                log.debug("[Reminders] Save still failing: {}", e.getMessage());
            }
            throw new ReminderPersistenceException("Failed to save reminders", e);
        }

        reminders = next;
        if (persistenceFailing) {
            persistenceFailing = false;
            log.info("[Reminders] Saving reminders works again");
        }
    }

    private void pruneCompleted(Map<String, Reminder> next) {
        int retention = settings.getCompletedRetention();
        if (retention <= 0) {
            return;
        }
        List<Reminder> completed = next.values().stream()
                .filter(reminder -> reminder.isCompleted() && !reminder.isRecurring())
                .sorted(Comparator.comparing(Reminder::getLastTriggered,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
        int excess = completed.size() - retention;
        for (int i = 0; i < excess; i++) {
            next.remove(completed.get(i).getId());
        }
        if (excess > 0) {
            log.debug("[Reminders] Pruned {} completed reminders", excess);
        }
    }
}

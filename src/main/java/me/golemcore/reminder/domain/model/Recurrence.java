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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Interval by which a recurring reminder advances after it fires.
 *
 * <p>
 * Persisted as a single-entry object: {@code {"days": 1}}, {@code {"weeks": 2}}
 * or {@code {"months": 1}}. Month arithmetic clamps the day-of-month to the
 * length of the target month, so January 31 plus one month lands on the last
 * day of February.
 */
public record Recurrence(Unit unit, int count) {

    public Recurrence {
        Objects.requireNonNull(unit, "unit");
        if (count < 1) {
            throw new IllegalArgumentException("Recurrence count must be positive, got " + count);
        }
    }

    public static Recurrence days(int count) {
        return new Recurrence(Unit.DAYS, count);
    }

    public static Recurrence weeks(int count) {
        return new Recurrence(Unit.WEEKS, count);
    }

    public static Recurrence months(int count) {
        return new Recurrence(Unit.MONTHS, count);
    }

    /**
     * Returns the instant one interval after {@code from}, computed in UTC.
     */
    public Instant advance(Instant from) {
        ZonedDateTime base = from.atZone(ZoneOffset.UTC);
        ZonedDateTime next = switch (unit) {
        case DAYS -> base.plusDays(count);
        case WEEKS -> base.plusWeeks(count);
        case MONTHS -> base.plusMonths(count);
        };
        return next.toInstant();
    }

    @JsonValue
    public Map<String, Integer> toJson() {
        return Map.of(unit.key(), count);
    }

    /**
     * Builds a recurrence from its persisted form.
     *
     * @throws IllegalArgumentException
     *             unless exactly one known unit with a positive count is present
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Recurrence fromJson(Map<String, Integer> value) {
        if (value == null || value.size() != 1) {
            throw new IllegalArgumentException("Recurrence must have exactly one unit, got " + value);
        }
        Map.Entry<String, Integer> entry = value.entrySet().iterator().next();
        if (entry.getValue() == null) {
            throw new IllegalArgumentException("Recurrence count is missing for " + entry.getKey());
        }
        return new Recurrence(Unit.fromKey(entry.getKey()), entry.getValue());
    }

    /**
     * Interval units.
     */
    public enum Unit {
        DAYS, WEEKS, MONTHS;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Unit fromKey(String key) {
            if (key == null) {
                throw new IllegalArgumentException("Recurrence unit is required");
            }
            for (Unit unit : values()) {
                if (unit.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                    return unit;
                }
            }
            throw new IllegalArgumentException("Unknown recurrence unit: " + key);
        }
    }
}

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
import me.golemcore.reminder.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts reminder content, due time and recurrence from free text such as
 * "remind me every day at 8am to take my medicine".
 *
 * <p>
 * Supported expressions:
 * <ul>
 * <li>Recurrence: daily / every day, weekly / every week, monthly / every
 * month</li>
 * <li>Day anchors: today, tomorrow, [on|next] &lt;weekday&gt;; "every
 * &lt;weekday&gt;" also makes the reminder weekly</li>
 * <li>Times: "at|by|for H[:MM][am|pm]" first, then a bare "H[:MM][am|pm]"</li>
 * </ul>
 *
 * <p>
 * Times resolve in the configured zone ({@code bot.reminders.zone}, UTC by
 * default). A resolved time that is not after {@code now} rolls forward one day
 * (one week for weekday anchors). Without a time the reminder is due one hour
 * from now, or at 09:00 when only a future day was named.
 *
 * <p>
 * Pure: no I/O and no shared state.
 */
@Component
public class ReminderTextParser {

    private static final Duration DEFAULT_DELAY = Duration.ofHours(1);
    private static final LocalTime DEFAULT_DAY_TIME = LocalTime.of(9, 0);
    private static final int MAX_HOUR = 23;
    private static final int MAX_MINUTE = 59;
    private static final int NOON = 12;

    private static final List<RecurrenceRule> RECURRENCE_RULES = List.of(
            new RecurrenceRule(Pattern.compile("\\b(?:every day|daily)\\b"), Recurrence.days(1)),
            new RecurrenceRule(Pattern.compile("\\b(?:every week|weekly)\\b"), Recurrence.weeks(1)),
            new RecurrenceRule(Pattern.compile("\\b(?:every month|monthly)\\b"), Recurrence.months(1)));

    private static final String NOT_A_DURATION = "(?!\\s*(?:minute|min|hour|hr|day|week|month|year)s?\\b)";

    private static final Pattern PREFIXED_TIME = Pattern.compile(
            "\\b(?:at|by|for)\\s+(\\d{1,2})(?::(\\d{2}))?\\s*([ap]m)?\\b" + NOT_A_DURATION);
    private static final Pattern BARE_TIME = Pattern.compile(
            "(?<![\\d:])\\b(\\d{1,2})(?::(\\d{2}))?\\s*([ap]m)?\\b" + NOT_A_DURATION);

    private static final Pattern TODAY = Pattern.compile("\\btoday\\b");
    private static final Pattern TOMORROW = Pattern.compile("\\btomorrow\\b");
    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(?:(on|next|every)\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b");

    private static final Pattern TRIGGER = Pattern.compile(
            "\\b(?:remind me(?:\\s+to)?|set\\s+(?:a\\s+)?reminder(?:\\s+(?:to|for))?)\\b\\s*");
    private static final Pattern LEADING_FILLER = Pattern.compile("^(?:that|to)\\b\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[.,!?]+|[.,!?]+$");

    private final ZoneId zone;

    public ReminderTextParser(BotProperties properties) {
        this.zone = ZoneId.of(properties.getReminders().getZone());
    }

    /**
     * Parses a reminder request.
     *
     * @return the parsed reminder, or empty when no reminder content remains
     *         after removing trigger phrases and time expressions
     */
    public Optional<ParsedReminder> parse(String rawText, Instant now) {
        if (rawText == null || rawText.isBlank()) {
            return Optional.empty();
        }

        String text = rawText.toLowerCase(Locale.ROOT);

        Recurrence recurrence = null;
        for (RecurrenceRule rule : RECURRENCE_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.find()) {
                recurrence = rule.recurrence();
                text = matcher.replaceAll(" ");
                break;
            }
        }

        ZonedDateTime localNow = now.atZone(zone);
        DayAnchor anchor = DayAnchor.none(localNow.toLocalDate());
        Matcher tomorrow = TOMORROW.matcher(text);
        Matcher weekday = WEEKDAY.matcher(text);
        Matcher today = TODAY.matcher(text);
        if (tomorrow.find()) {
            anchor = new DayAnchor(localNow.toLocalDate().plusDays(1), AnchorKind.TOMORROW);
            text = cut(text, tomorrow.start(), tomorrow.end());
        } else if (weekday.find()) {
            DayOfWeek day = DayOfWeek.valueOf(weekday.group(2).toUpperCase(Locale.ROOT));
            if ("every".equals(weekday.group(1)) && recurrence == null) {
                recurrence = Recurrence.weeks(1);
            }
            LocalDate date = localNow.toLocalDate().with(TemporalAdjusters.next(day));
            anchor = new DayAnchor(date, AnchorKind.WEEKDAY);
            text = cut(text, weekday.start(), weekday.end());
        } else if (today.find()) {
            text = cut(text, today.start(), today.end());
        }

        Instant dueTime;
        String searchText = text;
        Optional<TimeMatch> timeMatch = findTime(searchText, PREFIXED_TIME)
                .or(() -> findTime(searchText, BARE_TIME));
        if (timeMatch.isPresent()) {
            TimeMatch match = timeMatch.get();
            text = cut(text, match.start(), match.end());
            dueTime = resolve(anchor, match.time(), now);
        } else if (anchor.kind() != AnchorKind.NONE) {
            dueTime = resolve(anchor, DEFAULT_DAY_TIME, now);
        } else {
            dueTime = now.plus(DEFAULT_DELAY);
        }

        String cleaned = clean(text);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedReminder(cleaned, dueTime, recurrence));
    }

    public ZoneId getZone() {
        return zone;
    }

    private Instant resolve(DayAnchor anchor, LocalTime time, Instant now) {
        ZonedDateTime candidate = ZonedDateTime.of(anchor.date(), time, zone);
        if (!candidate.toInstant().isAfter(now)) {
            candidate = anchor.kind() == AnchorKind.WEEKDAY ? candidate.plusWeeks(1) : candidate.plusDays(1);
        }
        return candidate.toInstant();
    }

    private static Optional<TimeMatch> findTime(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            int hour = Integer.parseInt(matcher.group(1));
            int minute = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0;
            String period = matcher.group(3);

            if ("pm".equals(period) && hour < NOON) {
                hour += NOON;
            } else if ("am".equals(period) && hour == NOON) {
                hour = 0;
            }

            if (hour <= MAX_HOUR && minute <= MAX_MINUTE) {
                return Optional.of(new TimeMatch(LocalTime.of(hour, minute), matcher.start(), matcher.end()));
            }
        }
        return Optional.empty();
    }

    private static String clean(String text) {
        String cleaned = collapse(text);
        cleaned = collapse(TRIGGER.matcher(cleaned).replaceAll(" "));
        cleaned = LEADING_FILLER.matcher(cleaned).replaceFirst("");
        cleaned = collapse(cleaned);
        cleaned = EDGE_PUNCTUATION.matcher(cleaned).replaceAll("");
        return cleaned.trim();
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static String cut(String text, int start, int end) {
        return text.substring(0, start) + " " + text.substring(end);
    }

    private record RecurrenceRule(Pattern pattern, Recurrence recurrence) {
    }

    private record TimeMatch(LocalTime time, int start, int end) {
    }

    private enum AnchorKind {
        NONE, TOMORROW, WEEKDAY
    }

    private record DayAnchor(LocalDate date, AnchorKind kind) {
        static DayAnchor none(LocalDate today) {
            return new DayAnchor(today, AnchorKind.NONE);
        }
    }
}

package me.golemcore.reminder.domain.service;

import me.golemcore.reminder.domain.model.ParsedReminder;
import me.golemcore.reminder.domain.model.Recurrence;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReminderTextParserTest {

    // Monday
    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private ReminderTextParser parser;

    @BeforeEach
    void setUp() {
        parser = new ReminderTextParser(new BotProperties());
    }

    @Test
    void shouldParseTomorrowWithPrefixedTime() {
        ParsedReminder parsed = parser.parse("remind me to call mom tomorrow at 3pm", NOW).orElseThrow();

        assertEquals("call mom", parsed.text());
        assertEquals(Instant.parse("2024-01-02T15:00:00Z"), parsed.dueTime());
        assertNull(parsed.recurrence());
        assertFalse(parsed.recurring());
    }

    @Test
    void shouldParseDailyRecurrenceAndRollPastTimeForward() {
        Instant now = Instant.parse("2024-01-01T09:00:00Z");

        ParsedReminder parsed = parser.parse("remind me every day at 8am to take my medicine", now).orElseThrow();

        assertEquals("take my medicine", parsed.text());
        assertEquals(Recurrence.days(1), parsed.recurrence());
        assertEquals(Instant.parse("2024-01-02T08:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldDefaultToOneHourWhenNoTimeGiven() {
        ParsedReminder parsed = parser.parse("remind me to stretch", NOW).orElseThrow();

        assertEquals("stretch", parsed.text());
        assertEquals(NOW.plus(Duration.ofHours(1)), parsed.dueTime());
    }

    @Test
    void shouldRollTodaysPastTimeToTomorrow() {
        ParsedReminder parsed = parser.parse("remind me to eat lunch at 9am", NOW).orElseThrow();

        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldKeepLaterTimeToday() {
        ParsedReminder parsed = parser.parse("call the dentist 4:30pm", NOW).orElseThrow();

        assertEquals("call the dentist", parsed.text());
        assertEquals(Instant.parse("2024-01-01T16:30:00Z"), parsed.dueTime());
    }

    @Test
    void shouldTreatTwelveAmAsMidnight() {
        ParsedReminder parsed = parser.parse("take out the trash at 12am", NOW).orElseThrow();

        assertEquals("take out the trash", parsed.text());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldTreatTwelvePmAsNoon() {
        ParsedReminder parsed = parser.parse("standup at 12pm", NOW).orElseThrow();

        assertEquals(Instant.parse("2024-01-01T12:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldAcceptTwentyFourHourTime() {
        ParsedReminder parsed = parser.parse("water the plants at 18:45", NOW).orElseThrow();

        assertEquals("water the plants", parsed.text());
        assertEquals(Instant.parse("2024-01-01T18:45:00Z"), parsed.dueTime());
    }

    @Test
    void shouldParseWeeklyRecurrence() {
        ParsedReminder parsed = parser.parse("weekly team sync at 10:30", NOW).orElseThrow();

        assertEquals("team sync", parsed.text());
        assertEquals(Recurrence.weeks(1), parsed.recurrence());
        assertEquals(Instant.parse("2024-01-01T10:30:00Z"), parsed.dueTime());
    }

    @Test
    void shouldParseMonthlyRecurrenceWithoutTime() {
        ParsedReminder parsed = parser.parse("pay rent monthly", NOW).orElseThrow();

        assertEquals("pay rent", parsed.text());
        assertEquals(Recurrence.months(1), parsed.recurrence());
        assertEquals(NOW.plus(Duration.ofHours(1)), parsed.dueTime());
    }

    @Test
    void shouldPreferDailyOverLaterRecurrenceRules() {
        ParsedReminder parsed = parser.parse("daily and weekly review", NOW).orElseThrow();

        assertEquals(Recurrence.days(1), parsed.recurrence());
    }

    @Test
    void shouldSkipInvalidHourAndUseNextTime() {
        ParsedReminder parsed = parser.parse("call bob at 30 then at 6pm", NOW).orElseThrow();

        assertEquals(Instant.parse("2024-01-01T18:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldIgnoreImpossibleClockTime() {
        ParsedReminder parsed = parser.parse("check the oven at 25:00", NOW).orElseThrow();

        assertEquals(NOW.plus(Duration.ofHours(1)), parsed.dueTime());
    }

    @Test
    void shouldNotReadDurationsAsClockTimes() {
        ParsedReminder parsed = parser.parse("remind me to stretch in 10 minutes", NOW).orElseThrow();

        assertEquals(NOW.plus(Duration.ofHours(1)), parsed.dueTime());
        assertTrue(parsed.text().contains("10 minutes"));
    }

    @Test
    void shouldUseMorningDefaultForTomorrowWithoutTime() {
        ParsedReminder parsed = parser.parse("remind me to renew my passport tomorrow", NOW).orElseThrow();

        assertEquals("renew my passport", parsed.text());
        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldResolveNamedWeekday() {
        ParsedReminder parsed = parser.parse("dentist on friday at 2pm", NOW).orElseThrow();

        assertEquals("dentist", parsed.text());
        assertEquals(Instant.parse("2024-01-05T14:00:00Z"), parsed.dueTime());
        assertNull(parsed.recurrence());
    }

    @Test
    void shouldMakeEveryWeekdayWeeklyAndSkipToNextOccurrence() {
        ParsedReminder parsed = parser.parse("every monday at 9am stand-up", NOW).orElseThrow();

        assertEquals("stand-up", parsed.text());
        assertEquals(Recurrence.weeks(1), parsed.recurrence());
        assertEquals(Instant.parse("2024-01-08T09:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldStripTodayAnchor() {
        ParsedReminder parsed = parser.parse("remind me to submit the report today at 5pm", NOW).orElseThrow();

        assertEquals("submit the report", parsed.text());
        assertEquals(Instant.parse("2024-01-01T17:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldStripTrailingPunctuationAndNormalizeCase() {
        ParsedReminder parsed = parser.parse("Remind me to buy MILK!", NOW).orElseThrow();

        assertEquals("buy milk", parsed.text());
    }

    @Test
    void shouldStripLeadingThat() {
        ParsedReminder parsed = parser.parse("remind me that the parcel arrives tomorrow", NOW).orElseThrow();

        assertEquals("the parcel arrives", parsed.text());
    }

    @Test
    void shouldStripSetReminderTrigger() {
        ParsedReminder parsed = parser.parse("set a reminder for dinner at 7pm", NOW).orElseThrow();

        assertEquals("dinner", parsed.text());
        assertEquals(Instant.parse("2024-01-01T19:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldStripTriggerInsideSentence() {
        ParsedReminder politely = parser.parse("please remind me to call mom at 3pm", NOW).orElseThrow();
        ParsedReminder asked = parser.parse("can you set a reminder to water plants at 6pm", NOW).orElseThrow();

        assertEquals("please call mom", politely.text());
        assertEquals(Instant.parse("2024-01-01T15:00:00Z"), politely.dueTime());
        assertEquals("can you water plants", asked.text());
        assertEquals(Instant.parse("2024-01-01T18:00:00Z"), asked.dueTime());
    }

    @Test
    void shouldKeepToInsideReminderText() {
        ParsedReminder parsed = parser.parse("remind me to go to the gym at 6pm", NOW).orElseThrow();

        assertEquals("go to the gym", parsed.text());
    }

    @Test
    void shouldFailWhenNothingRemainsToRemind() {
        assertTrue(parser.parse("remind me", NOW).isEmpty());
        assertTrue(parser.parse("remind me at 5pm", NOW).isEmpty());
        assertTrue(parser.parse("   ", NOW).isEmpty());
        assertTrue(parser.parse(null, NOW).isEmpty());
    }

    @Test
    void shouldResolveTimesInConfiguredZone() {
        BotProperties properties = new BotProperties();
        properties.getReminders().setZone("Europe/Berlin");
        ReminderTextParser berlinParser = new ReminderTextParser(properties);

        ParsedReminder parsed = berlinParser.parse("call mom tomorrow at 9am", NOW).orElseThrow();

        assertEquals(Instant.parse("2024-01-02T08:00:00Z"), parsed.dueTime());
    }

    @Test
    void shouldNeverScheduleInThePast() {
        String[] inputs = { "a at 1am", "b at 9:59", "c 10am", "d at 10:00", "e tomorrow at 3am", "f every day at 6" };
        for (String input : inputs) {
            ParsedReminder parsed = parser.parse(input, NOW).orElseThrow();
            assertTrue(parsed.dueTime().isAfter(NOW), input);
        }
    }
}

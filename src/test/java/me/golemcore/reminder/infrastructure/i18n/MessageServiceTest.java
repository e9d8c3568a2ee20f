package me.golemcore.reminder.infrastructure.i18n;

import me.golemcore.reminder.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private static final String KEY_ALERT_TITLE = "reminder.alert.title";

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    @Test
    void shouldReturnEnglishMessageByDefault() {
        assertEquals("Reminder", messageService.getMessage(KEY_ALERT_TITLE));
        assertEquals(Locale.ENGLISH, messageService.getLocale());
    }

    @Test
    void shouldReturnRussianMessageWhenLanguageSetToRu() {
        messageService.setLanguage("ru");

        String result = messageService.getMessage(KEY_ALERT_TITLE);

        assertEquals("Напоминание", result);
        assertEquals("ru", messageService.getLocale().getLanguage());
    }

    @Test
    void shouldFallBackToEnglishForUnsupportedLanguage() {
        messageService.setLanguage("xx");

        assertEquals("en", messageService.getLanguage());
        assertEquals("Reminder", messageService.getMessage(KEY_ALERT_TITLE));
    }

    @Test
    void shouldUseConfiguredLanguage() {
        BotProperties properties = new BotProperties();
        properties.getReminders().setLanguage("ru");

        MessageService configured = new MessageService(properties);

        assertEquals("ru", configured.getLanguage());
        assertEquals("Напоминание", configured.getMessage(KEY_ALERT_TITLE));
        assertTrue(configured.isSupported("en"));
        assertFalse(configured.isSupported("de"));
    }

    @Test
    void shouldReturnKeyWhenMessageNotFound() {
        assertEquals("nonexistent.key", messageService.getMessage("nonexistent.key"));
    }

    @Test
    void shouldFormatMessageWithParameters() {
        assertEquals("Reminder: call mom", messageService.getMessage("reminder.speech", "call mom"));
        assertEquals("every 3 days", messageService.getMessage("recurrence.days.many", 3));
    }

    @Test
    void shouldKeepApostropheInConfirmation() {
        String result = messageService.getMessageForLanguage("command.remind.confirm", "en",
                "call mom", "", "03:00 PM", "Tuesday, January 02");

        assertEquals("I'll remind you to call mom at 03:00 PM on Tuesday, January 02.", result);
    }

    @Test
    void shouldReturnUnformattedMessageWithoutParameters() {
        assertEquals("Unknown command: /{0}", messageService.getMessage("command.unknown"));
    }
}

package me.golemcore.reminder.infrastructure.i18n;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Localized reply and alert texts.
 *
 * <p>
 * Bundles are loaded from {@code messages_<lang>.properties}; English is the
 * fallback. Arguments use {@link MessageFormat} syntax. A key missing from
 * every bundle is returned as-is.
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_RU = "ru";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_RU);
    // English lives in the base bundle; never fall back to the JVM default locale.
    private static final ResourceBundle.Control NO_FALLBACK = ResourceBundle.Control
            .getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();
    private volatile String language = DEFAULT_LANG;

    public MessageService() {
        for (String lang : SUPPORTED_LANGUAGES) {
            try {
                bundles.put(lang, ResourceBundle.getBundle("messages", Locale.forLanguageTag(lang), NO_FALLBACK));
            } catch (MissingResourceException e) {
                log.warn("[Messages] No message bundle for language: {}", lang);
            }
        }
    }

    /**
     * Creates the service with the language from {@code bot.reminders.language}.
     */
    @Autowired
    public MessageService(BotProperties properties) {
        this();
        setLanguage(properties.getReminders().getLanguage());
    }

    public String getMessage(String key, Object... args) {
        return getMessageForLanguage(key, language, args);
    }

    public String getMessageForLanguage(String key, String lang, Object... args) {
        ResourceBundle bundle = bundles.getOrDefault(lang, bundles.get(DEFAULT_LANG));
        if (bundle == null) {
            return key;
        }
        try {
            String message = bundle.getString(key);
            if (args != null && args.length > 0) {
                return new MessageFormat(message, Locale.forLanguageTag(lang)).format(args);
            }
            return message;
        } catch (MissingResourceException e) {
            log.warn("[Messages] Missing message key: {} for language: {}", key, lang);
            return key;
        }
    }

    public String getLanguage() {
        return language;
    }

    public boolean isSupported(String lang) {
        return SUPPORTED_LANGUAGES.contains(lang);
    }

    public void setLanguage(String lang) {
        if (SUPPORTED_LANGUAGES.contains(lang)) {
            language = lang;
            log.info("[Messages] Language set to: {}", lang);
        } else {
            log.warn("[Messages] Unsupported language: {}, using default", lang);
            language = DEFAULT_LANG;
        }
    }

    public Locale getLocale() {
        return Locale.forLanguageTag(language);
    }
}

package me.golemcore.reminder.adapter.inbound.command;

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

import me.golemcore.reminder.domain.model.Recurrence;
import me.golemcore.reminder.domain.model.Reminder;
import me.golemcore.reminder.domain.service.ReminderPersistenceException;
import me.golemcore.reminder.domain.service.ReminderService;
import me.golemcore.reminder.domain.service.ReminderTextParser;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.infrastructure.i18n.MessageService;
import me.golemcore.reminder.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Routes reminder dialogue commands to {@link ReminderService}.
 *
 * <ul>
 * <li>remind &lt;text&gt; - parse and store a reminder</li>
 * <li>reminders [limit] - list upcoming reminders</li>
 * <li>due - list reminders due now</li>
 * <li>cancel &lt;id&gt; - delete a reminder</li>
 * <li>done &lt;id&gt; - complete a reminder</li>
 * <li>lang [en|ru] - show or switch the reply language</li>
 * <li>help - show available commands</li>
 * </ul>
 *
 * <p>
 * {@link #handleUtterance(String)} recognizes the same intents in plain
 * sentences such as "remind me to stretch in the evening at 7pm" or "what are
 * my reminders".
 */
@Component
@Slf4j
public class ReminderCommandRouter implements CommandPort {

    private static final String CMD_REMIND = "remind";
    private static final String CMD_REMINDERS = "reminders";
    private static final String CMD_DUE = "due";
    private static final String CMD_CANCEL = "cancel";
    private static final String CMD_DONE = "done";
    private static final String CMD_HELP = "help";
    private static final String CMD_LANG = "lang";

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_REMIND, CMD_REMINDERS, CMD_DUE, CMD_CANCEL, CMD_DONE, CMD_LANG, CMD_HELP);
    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);

    private static final Pattern ADD_INTENT = Pattern.compile(
            "\\b(?:remind me|set\\s+(?:a\\s+)?reminder)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_INTENT = Pattern.compile(
            "\\b(?:what are my reminders|(?:list|show)(?: me)?(?: my)? reminders)\\b", Pattern.CASE_INSENSITIVE);

    private final ReminderService reminderService;
    private final MessageService messageService;
    private final ReminderTextParser parser;
    private final BotProperties.ReminderProperties settings;

    public ReminderCommandRouter(ReminderService reminderService, MessageService messageService,
            ReminderTextParser parser, BotProperties properties) {
        this.reminderService = reminderService;
        this.messageService = messageService;
        this.parser = parser;
        this.settings = properties.getReminders();
        log.info("ReminderCommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Executing command: /{}", command);
            if (!hasCommand(command)) {
                return CommandResult.failure(msg("command.unknown", command));
            }
            try {
                return switch (command) {
                case CMD_REMIND -> handleRemind(String.join(" ", args));
                case CMD_REMINDERS -> handleReminders(args);
                case CMD_DUE -> handleDue();
                case CMD_CANCEL -> handleCancel(args);
                case CMD_DONE -> handleDone(args);
                case CMD_LANG -> handleLang(args);
                case CMD_HELP -> handleHelp();
                default -> CommandResult.failure(msg("command.unknown", command));
                };
            } catch (ReminderPersistenceException e) {
                log.warn("[Reminders] Command /{} not saved: {}", command, e.getMessage());
                return CommandResult.failure(msg("command.save-failed"));
            }
        });
    }

    /**
     * Handles a free-form sentence if it carries a reminder intent.
     *
     * @return empty when the sentence is not about reminders
     */
    public Optional<CommandResult> handleUtterance(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        String text = utterance.strip();
        try {
            if (ADD_INTENT.matcher(text).find()) {
                return Optional.of(handleRemind(text));
            }
            if (LIST_INTENT.matcher(text).find()) {
                return Optional.of(handleReminders(List.of()));
            }
        } catch (ReminderPersistenceException e) {
            log.warn("[Reminders] Utterance not saved: {}", e.getMessage());
            return Optional.of(CommandResult.failure(msg("command.save-failed")));
        }
        return Optional.empty();
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_REMIND, "Create a reminder", "/remind <what and when>"),
                new CommandDefinition(CMD_REMINDERS, "List upcoming reminders", "/reminders [limit]"),
                new CommandDefinition(CMD_DUE, "List reminders due now", "/due"),
                new CommandDefinition(CMD_CANCEL, "Delete a reminder", "/cancel <id>"),
                new CommandDefinition(CMD_DONE, "Mark a reminder as done", "/done <id>"),
                new CommandDefinition(CMD_LANG, "Show or switch the reply language", "/lang [en|ru]"),
                new CommandDefinition(CMD_HELP, "Show available commands", "/help"));
    }

    private CommandResult handleRemind(String text) {
        if (text.isBlank()) {
            return CommandResult.failure(msg("command.remind.usage"));
        }
        Optional<Reminder> created = reminderService.addFromText(text);
        if (created.isEmpty()) {
            return CommandResult.failure(msg("command.remind.parse-failed"));
        }
        Reminder reminder = created.get();
        ZonedDateTime due = reminder.getDueTime().atZone(parser.getZone());
        String confirmation = msg("command.remind.confirm",
                reminder.getText(),
                describeRecurrence(reminder.getRecurringInterval()),
                formatter("format.time").format(due),
                formatter("format.date").format(due));
        return CommandResult.success(confirmation, reminder);
    }

    private CommandResult handleReminders(List<String> args) {
        int limit = settings.getDefaultListLimit();
        if (!args.isEmpty()) {
            try {
                limit = Integer.parseInt(args.get(0));
            } catch (NumberFormatException e) {
                return CommandResult.failure(msg("command.reminders.invalid-limit", args.get(0)));
            }
            if (limit < 1) {
                return CommandResult.failure(msg("command.reminders.invalid-limit", args.get(0)));
            }
            limit = Math.min(limit, settings.getMaxListLimit());
        }

        List<Reminder> upcoming = reminderService.upcoming(limit);
        if (upcoming.isEmpty()) {
            return CommandResult.success(msg("command.reminders.empty"), upcoming);
        }
        return CommandResult.success(formatList(msg("command.reminders.title", upcoming.size()), upcoming),
                upcoming);
    }

    private CommandResult handleDue() {
        List<Reminder> due = reminderService.dueNow();
        if (due.isEmpty()) {
            return CommandResult.success(msg("command.due.empty"), due);
        }
        return CommandResult.success(formatList(msg("command.due.title", due.size()), due), due);
    }

    private CommandResult handleCancel(List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.cancel.usage"));
        }
        String id = args.get(0);
        if (reminderService.cancel(id)) {
            return CommandResult.success(msg("command.cancel.done", id));
        }
        return CommandResult.failure(msg("command.cancel.not-found", id));
    }

    private CommandResult handleDone(List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.done.usage"));
        }
        String id = args.get(0);
        if (reminderService.markDone(id)) {
            return CommandResult.success(msg("command.done.done", id));
        }
        return CommandResult.failure(msg("command.done.not-found", id));
    }

    private CommandResult handleLang(List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.success(msg("command.lang.current", messageService.getLanguage()));
        }
        String lang = args.get(0).toLowerCase(Locale.ROOT);
        if (!messageService.isSupported(lang)) {
            return CommandResult.failure(msg("command.lang.unsupported", args.get(0)));
        }
        messageService.setLanguage(lang);
        return CommandResult.success(msg("command.lang.changed"));
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder(msg("command.help.title"));
        for (CommandDefinition definition : listCommands()) {
            sb.append("\n").append(definition.usage()).append(" - ").append(definition.description());
        }
        return CommandResult.success(sb.toString());
    }

    private String formatList(String title, List<Reminder> reminders) {
        DateTimeFormatter dateTime = formatter("format.datetime");
        StringBuilder sb = new StringBuilder(title);
        for (Reminder reminder : reminders) {
            sb.append("\n").append(msg("command.reminders.item",
                    reminder.getId(),
                    dateTime.format(reminder.getDueTime().atZone(parser.getZone())),
                    reminder.getText(),
                    describeRecurrence(reminder.getRecurringInterval())));
        }
        return sb.toString();
    }

    private String describeRecurrence(Recurrence recurrence) {
        if (recurrence == null) {
            return "";
        }
        String unitKey = recurrence.unit().key();
        String phrase = recurrence.count() == 1
                ? msg("recurrence." + unitKey + ".one")
                : msg("recurrence." + unitKey + ".many", recurrence.count());
        return " " + phrase;
    }

    private DateTimeFormatter formatter(String patternKey) {
        return DateTimeFormatter.ofPattern(msg(patternKey), messageService.getLocale());
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}

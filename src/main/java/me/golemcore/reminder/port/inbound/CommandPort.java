package me.golemcore.reminder.port.inbound;

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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for dialogue commands such as {@code remind}, {@code reminders} and
 * {@code cancel}.
 */
public interface CommandPort {

    /**
     * Executes a command with the given arguments and context.
     *
     * @param command
     *            command name without leading slash
     * @param args
     *            command arguments
     * @param context
     *            caller metadata
     * @return result with success status and reply text
     */
    CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context);

    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    /**
     * Result of a command execution.
     */
    record CommandResult(
            boolean success,
            String output,
            Object data
    ) {
        public static CommandResult success(String output) {
            return new CommandResult(true, output, null);
        }

        public static CommandResult success(String output, Object data) {
            return new CommandResult(true, output, data);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error, null);
        }
    }

    record CommandDefinition(
            String name,
            String description,
            String usage
    ) {}
}

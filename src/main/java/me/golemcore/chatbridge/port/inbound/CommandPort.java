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

package me.golemcore.chatbridge.port.inbound;

import java.util.List;

/**
 * Port for slash commands (/help, /clear, /model, ...). Commands bypass the
 * exchange and never reach a model backend.
 */
public interface CommandPort {

    /**
     * Executes a command.
     *
     * @param command
     *            command name without the leading slash
     * @param args
     *            whitespace-separated arguments
     * @param chatId
     *            chat the command was sent from
     * @return result with the reply text, or {@code null} output if the command
     *         already replied on its own
     */
    CommandResult execute(String command, List<String> args, String chatId);

    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    /**
     * Outcome of a command with the text to send back.
     */
    record CommandResult(boolean success, String output) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error);
        }
    }

    /**
     * Command name, description and usage line for help output.
     */
    record CommandDefinition(String name, String description, String usage) {
    }
}

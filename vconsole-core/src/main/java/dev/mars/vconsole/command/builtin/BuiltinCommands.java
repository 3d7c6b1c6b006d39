/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.vconsole.command.builtin;

import dev.mars.vconsole.command.CommandHandler;
import dev.mars.vconsole.command.CommandRegistry;
import dev.mars.vconsole.core.exceptions.CommandRegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The commands every shell context starts with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public final class BuiltinCommands {

    private static final Logger logger = LoggerFactory.getLogger(BuiltinCommands.class);

    private BuiltinCommands() {
        // Utility class
    }

    public static List<CommandHandler> create(CommandRegistry registry) {
        return List.of(
                new AliasCommand(),
                new CatCommand(),
                new CdCommand(),
                new ClearCommand(),
                new CpCommand(),
                new DateCommand(),
                new EchoCommand(),
                new EnvCommand(),
                new ExitCommand(),
                new ExportCommand(),
                new FalseCommand(),
                new HelpCommand(registry),
                new HistoryCommand(),
                new LsCommand(),
                new MkdirCommand(),
                new MvCommand(),
                new PwdCommand(),
                new RmCommand(),
                new TestCommand(),
                new TouchCommand(),
                new TrueCommand(),
                new UnaliasCommand(),
                new UnsetCommand(),
                new WhichCommand(registry));
    }

    /**
     * Registers every built-in command with {@code registry}.
     *
     * @throws CommandRegistrationException if a built-in name is already taken
     */
    public static void registerAll(CommandRegistry registry) throws CommandRegistrationException {
        List<CommandHandler> commands = create(registry);
        for (CommandHandler command : commands) {
            registry.register(command);
        }
        logger.info("Registered {} built-in commands", commands.size());
    }
}

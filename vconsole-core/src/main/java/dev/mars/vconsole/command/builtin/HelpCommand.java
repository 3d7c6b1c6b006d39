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

import dev.mars.vconsole.command.BaseCommand;
import dev.mars.vconsole.command.CommandContext;
import dev.mars.vconsole.command.CommandHandler;
import dev.mars.vconsole.command.CommandRegistry;
import dev.mars.vconsole.command.ExitCode;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * {@code help [command]}: lists the registered commands or describes one.
 */
public final class HelpCommand extends BaseCommand {

    private final CommandRegistry registry;

    public HelpCommand(CommandRegistry registry) {
        super("help", "Display information about commands", "help [COMMAND]");
        this.registry = registry;
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        if (args.positional().isEmpty()) {
            StringBuilder out = new StringBuilder("Available commands:\n\n");
            for (String name : registry.list()) {
                registry.get(name).ifPresent(handler ->
                        out.append(String.format("  %-12s %s\n", name, handler.description())));
            }
            out.append("\nType \"help <command>\" for more information about a specific command.\n");
            context.out(out.toString());
            return Future.succeededFuture(ExitCode.SUCCESS);
        }

        String name = args.positional().get(0);
        Optional<CommandHandler> handler = registry.get(name);
        if (handler.isEmpty()) {
            return fail(context, "no help topics match '" + name + "'");
        }
        CommandHandler command = handler.get();
        context.out(name + " - " + command.description() + "\n\nUsage: " + command.usage() + "\n");
        return Future.succeededFuture(ExitCode.SUCCESS);
    }
}

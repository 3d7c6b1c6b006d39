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
import dev.mars.vconsole.command.CommandKind;
import dev.mars.vconsole.command.CommandRegistry;
import dev.mars.vconsole.command.ExitCode;
import io.vertx.core.Future;

import java.util.Locale;
import java.util.Map;

/**
 * {@code which name...}: reports how each name would be resolved.
 */
public final class WhichCommand extends BaseCommand {

    private final CommandRegistry registry;

    public WhichCommand(CommandRegistry registry) {
        super("which", "Locate a command", "which COMMAND...");
        this.registry = registry;
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        if (args.positional().isEmpty()) {
            return fail(context, "missing command name");
        }
        Map<String, String> sessionAliases = context.getSession() == null
                ? Map.of()
                : context.getSession().getAliases();

        int status = ExitCode.SUCCESS;
        StringBuilder out = new StringBuilder();
        for (String name : args.positional()) {
            if (sessionAliases.containsKey(name)) {
                out.append(name).append(": aliased to ").append(sessionAliases.get(name)).append('\n');
            } else if (registry.isAlias(name)) {
                out.append(name).append(": aliased to ").append(registry.getAliases().get(name)).append('\n');
            } else if (registry.has(name)) {
                CommandKind kind = registry.get(name).map(CommandHandler::kind).orElse(CommandKind.EXTERNAL);
                out.append(name).append(kind == CommandKind.BUILTIN
                        ? ": shell built-in command"
                        : ": " + kind.name().toLowerCase(Locale.ROOT) + " command").append('\n');
            } else {
                status = error(context, name + ": not found");
            }
        }
        context.out(out.toString());
        return Future.succeededFuture(status);
    }
}

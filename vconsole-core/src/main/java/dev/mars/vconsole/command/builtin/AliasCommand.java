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
import dev.mars.vconsole.command.ExitCode;
import dev.mars.vconsole.command.ShellSession;
import io.vertx.core.Future;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code alias [-p] [name[=value]...]}: defines session aliases, whose value
 * replaces the command name when the alias is invoked. Lists registry and
 * session aliases when called without operands.
 */
public final class AliasCommand extends BaseCommand {

    private static final Pattern DEFINITION = Pattern.compile("([A-Za-z_][A-Za-z0-9_.-]*)=(.*)", Pattern.DOTALL);
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    public AliasCommand() {
        super("alias", "Define or display aliases", "alias [-p] [NAME[=VALUE]]...");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        ShellSession session = context.getSession();
        if (session == null) {
            return fail(context, "no session");
        }
        Map<String, String> aliases = allAliases(session);
        if (args.positional().isEmpty() || args.has("p")) {
            StringBuilder out = new StringBuilder();
            aliases.forEach((name, value) -> out.append(format(name, value)));
            context.out(out.toString());
            return Future.succeededFuture(ExitCode.SUCCESS);
        }

        int status = ExitCode.SUCCESS;
        for (String arg : args.positional()) {
            Matcher definition = DEFINITION.matcher(arg);
            if (definition.matches()) {
                session.setAlias(definition.group(1), definition.group(2));
            } else if (NAME.matcher(arg).matches()) {
                String value = aliases.get(arg);
                if (value == null) {
                    status = error(context, arg + ": not found");
                } else {
                    context.out(format(arg, value));
                }
            } else {
                status = error(context, "`" + arg + "': invalid alias name");
            }
        }
        return Future.succeededFuture(status);
    }

    static Map<String, String> allAliases(ShellSession session) {
        Map<String, String> aliases = new TreeMap<>(session.getRegistry().getAliases());
        aliases.putAll(session.getAliases());
        return aliases;
    }

    private static String format(String name, String value) {
        return "alias " + name + "='" + value.replace("'", "'\\''") + "'\n";
    }
}

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
import java.util.regex.Pattern;

/**
 * {@code export [-p] [name[=value]...]}: sets session variables. Without
 * operands it prints them in re-usable form.
 */
public final class ExportCommand extends BaseCommand {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public ExportCommand() {
        super("export", "Set environment variables", "export [-p] [NAME[=VALUE]]...");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        ShellSession session = context.getSession();
        if (session == null) {
            return fail(context, "no session");
        }
        if (args.positional().isEmpty()) {
            StringBuilder out = new StringBuilder();
            new TreeMap<>(session.getEnvironment()).forEach((name, value) ->
                    out.append("declare -x ").append(name).append("=\"").append(quote(value)).append("\"\n"));
            context.out(out.toString());
            return Future.succeededFuture(ExitCode.SUCCESS);
        }

        int status = ExitCode.SUCCESS;
        Map<String, String> current = session.getEnvironment();
        for (String arg : args.positional()) {
            int equals = arg.indexOf('=');
            String name = equals >= 0 ? arg.substring(0, equals) : arg;
            if (!IDENTIFIER.matcher(name).matches()) {
                status = error(context, "`" + arg + "': not a valid identifier");
                continue;
            }
            if (equals >= 0) {
                session.setEnvironment(name, arg.substring(equals + 1));
            } else if (!current.containsKey(name)) {
                session.setEnvironment(name, context.getEnv(name, ""));
            }
        }
        return Future.succeededFuture(status);
    }

    private static String quote(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

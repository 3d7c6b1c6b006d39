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

/**
 * {@code unset [-v] name...}: removes session variables. Unknown names are
 * not an error.
 */
public final class UnsetCommand extends BaseCommand {

    public UnsetCommand() {
        super("unset", "Remove environment variables", "unset [-v] NAME...");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        ShellSession session = context.getSession();
        if (session == null) {
            return fail(context, "no session");
        }
        if (args.has("f")) {
            return Future.succeededFuture(usageError(context, "-f: functions are not supported"));
        }
        int status = ExitCode.SUCCESS;
        for (String name : args.positional()) {
            if (!ExportCommand.IDENTIFIER.matcher(name).matches()) {
                status = error(context, "`" + name + "': not a valid identifier");
                continue;
            }
            session.unsetEnvironment(name);
        }
        return Future.succeededFuture(status);
    }
}

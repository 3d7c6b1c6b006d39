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
import io.vertx.core.Future;

/**
 * {@code exit [n]}: asks the host to end the session. A non-numeric argument
 * fails with exit code 128.
 */
public final class ExitCommand extends BaseCommand {

    public ExitCommand() {
        super("exit", "Exit the shell", "exit [N]");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        if (context.getArgs().size() > 1) {
            return fail(context, "too many arguments");
        }
        int code = ExitCode.SUCCESS;
        if (!context.getArgs().isEmpty()) {
            String operand = context.getArgs().get(0);
            try {
                code = Integer.parseInt(operand) & 0xFF;
            } catch (NumberFormatException e) {
                context.err("exit: " + operand + ": numeric argument required\n");
                return Future.succeededFuture(ExitCode.INVALID_EXIT_ARGUMENT);
            }
        }
        if (context.getSession() != null) {
            context.getSession().requestExit(code);
        }
        return Future.succeededFuture(code);
    }
}

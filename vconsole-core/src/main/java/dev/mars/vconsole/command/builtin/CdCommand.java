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
 * {@code cd [dir | -]}: changes the session's working directory. Without an
 * operand it goes to {@code $HOME}; {@code -} returns to the previous
 * directory and prints it.
 */
public final class CdCommand extends BaseCommand {

    public CdCommand() {
        super("cd", "Change the working directory", "cd [DIR | -]");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        ShellSession session = context.getSession();
        if (session == null) {
            return fail(context, "no session to change directory in");
        }
        if (context.getArgs().size() > 1) {
            return fail(context, "too many arguments");
        }

        String target;
        boolean announce = false;
        if (context.getArgs().isEmpty()) {
            target = context.getEnv("HOME", "/");
        } else if ("-".equals(context.getArgs().get(0))) {
            target = session.getPreviousDirectory();
            if (target == null) {
                return fail(context, "OLDPWD not set");
            }
            announce = true;
        } else {
            target = context.getArgs().get(0);
        }

        String operand = target;
        boolean print = announce;
        return session.changeDirectory(target)
                .map(cwd -> {
                    if (print) {
                        context.out(cwd + "\n");
                    }
                    return ExitCode.SUCCESS;
                })
                .otherwise(err -> error(context, operand, err));
    }
}

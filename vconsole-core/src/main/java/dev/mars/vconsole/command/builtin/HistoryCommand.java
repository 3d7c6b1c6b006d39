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

import java.util.List;

/**
 * {@code history [-c] [n]}: prints the session history numbered from 1, or
 * the last {@code n} entries.
 */
public final class HistoryCommand extends BaseCommand {

    public HistoryCommand() {
        super("history", "Display or clear the command history", "history [-c] [N]");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        ShellSession session = context.getSession();
        if (session == null) {
            return fail(context, "no session");
        }
        if (args.has("c")) {
            session.clearHistory();
            return Future.succeededFuture(ExitCode.SUCCESS);
        }

        List<String> history = session.getHistory();
        int count = history.size();
        if (!args.positional().isEmpty()) {
            String operand = args.positional().get(0);
            try {
                count = Math.min(Integer.parseInt(operand), history.size());
            } catch (NumberFormatException e) {
                return fail(context, operand + ": numeric argument required");
            }
            if (count < 0) {
                return fail(context, operand + ": invalid option");
            }
        }

        StringBuilder out = new StringBuilder();
        for (int i = history.size() - count; i < history.size(); i++) {
            out.append(String.format("%5d  %s\n", i + 1, history.get(i)));
        }
        context.out(out.toString());
        return Future.succeededFuture(ExitCode.SUCCESS);
    }
}

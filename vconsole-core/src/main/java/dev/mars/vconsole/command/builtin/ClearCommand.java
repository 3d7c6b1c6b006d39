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
 * {@code clear}: writes the ANSI clear-screen sequence for the host terminal.
 */
public final class ClearCommand extends BaseCommand {

    public static final String CLEAR_SEQUENCE = "\u001b[2J\u001b[H";

    public ClearCommand() {
        super("clear", "Clear the terminal screen", "clear");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        context.out(CLEAR_SEQUENCE);
        return Future.succeededFuture(ExitCode.SUCCESS);
    }
}

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

import java.util.Map;
import java.util.TreeMap;

/**
 * {@code env [-i] [-0] [NAME=VALUE...]}: prints the effective environment,
 * optionally starting empty and with extra assignments.
 */
public final class EnvCommand extends BaseCommand {

    public EnvCommand() {
        super("env", "Print the environment", "env [-i0] [NAME=VALUE]...");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        Map<String, String> environment = new TreeMap<>();
        if (!args.has("i", "ignore-environment")) {
            environment.putAll(context.getEnvironment());
        }
        for (String operand : args.positional()) {
            int equals = operand.indexOf('=');
            if (equals <= 0) {
                return Future.succeededFuture(
                        usageError(context, "'" + operand + "': running commands is not supported"));
            }
            environment.put(operand.substring(0, equals), operand.substring(equals + 1));
        }
        String terminator = args.has("0", "null") ? "\0" : "\n";
        StringBuilder out = new StringBuilder();
        environment.forEach((name, value) -> out.append(name).append('=').append(value).append(terminator));
        context.out(out.toString());
        return Future.succeededFuture(ExitCode.SUCCESS);
    }
}

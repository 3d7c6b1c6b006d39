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
import dev.mars.vconsole.vfs.VirtualFileSystem;
import io.vertx.core.Future;

import java.util.List;

/**
 * {@code mv [-v] source... dest}: renames within a mount, or moves into
 * {@code dest} when it is a directory.
 */
public final class MvCommand extends BaseCommand {

    public MvCommand() {
        super("mv", "Move or rename files", "mv [-v] SOURCE... DEST");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        List<String> operands = args.positional();
        if (operands.size() < 2) {
            return Future.succeededFuture(usageError(context, operands.isEmpty()
                    ? "missing file operand"
                    : "missing destination file operand after '" + operands.get(0) + "'"));
        }
        boolean verbose = args.has("v", "verbose");
        VirtualFileSystem vfs = context.getVfs();
        List<String> sources = operands.subList(0, operands.size() - 1);
        String destOperand = operands.get(operands.size() - 1);
        String dest = context.resolvePath(destOperand);

        return CpCommand.isDirectory(vfs, dest).compose(destIsDir -> {
            if (sources.size() > 1 && !destIsDir) {
                return fail(context, "target '" + destOperand + "' is not a directory");
            }
            return forEach(sources, operand -> vfs.rename(context.resolvePath(operand), dest)
                    .map(v -> {
                        if (verbose) {
                            context.out("renamed '" + operand + "' -> '" + destOperand + "'\n");
                        }
                        return ExitCode.SUCCESS;
                    })
                    .otherwise(err -> error(context,
                            "cannot move '" + operand + "' to '" + destOperand + "'", err)));
        });
    }
}

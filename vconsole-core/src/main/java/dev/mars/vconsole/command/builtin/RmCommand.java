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
import dev.mars.vconsole.core.exceptions.VfsErrorCode;
import dev.mars.vconsole.core.exceptions.VfsException;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import io.vertx.core.Future;

/**
 * {@code rm [-rfv] file...}. Directories need {@code -r}; {@code -f} ignores
 * missing operands.
 */
public final class RmCommand extends BaseCommand {

    public RmCommand() {
        super("rm", "Remove files or directories", "rm [-rfv] FILE...");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        boolean recursive = args.has("r", "R", "recursive");
        boolean force = args.has("f", "force");
        boolean verbose = args.has("v", "verbose");
        if (args.positional().isEmpty()) {
            return Future.succeededFuture(force ? ExitCode.SUCCESS : usageError(context, "missing operand"));
        }
        VirtualFileSystem vfs = context.getVfs();

        return forEach(args.positional(), operand -> {
            String path = context.resolvePath(operand);
            return vfs.lstat(path)
                    .compose(inode -> {
                        if (!inode.isDirectory()) {
                            return vfs.deleteFile(path).map(v -> removed(context, verbose, "removed '" + operand + "'"));
                        }
                        if (!recursive) {
                            return Future.succeededFuture(
                                    error(context, "cannot remove '" + operand + "': Is a directory"));
                        }
                        return vfs.deleteDir(path, true)
                                .map(v -> removed(context, verbose, "removed directory '" + operand + "'"));
                    })
                    .otherwise(err -> force && isNotFound(err)
                            ? ExitCode.SUCCESS
                            : error(context, "cannot remove '" + operand + "'", err));
        });
    }

    private static int removed(CommandContext context, boolean verbose, String message) {
        if (verbose) {
            context.out(message + "\n");
        }
        return ExitCode.SUCCESS;
    }

    private static boolean isNotFound(Throwable err) {
        return err instanceof VfsException vfs && vfs.getCode() == VfsErrorCode.NOT_FOUND;
    }
}

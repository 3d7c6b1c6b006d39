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
 * {@code mkdir [-pv] dir...}. With {@code -p}, missing parents are created and
 * an existing directory is not an error.
 */
public final class MkdirCommand extends BaseCommand {

    public MkdirCommand() {
        super("mkdir", "Make directories", "mkdir [-pv] DIRECTORY...");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        if (args.positional().isEmpty()) {
            return Future.succeededFuture(usageError(context, "missing operand"));
        }
        boolean parents = args.has("p", "parents");
        boolean verbose = args.has("v", "verbose");
        VirtualFileSystem vfs = context.getVfs();

        return forEach(args.positional(), operand -> {
            String path = context.resolvePath(operand);
            Future<Boolean> skip = parents
                    ? vfs.stat(path)
                            .compose(inode -> inode.isDirectory()
                                    ? Future.succeededFuture(true)
                                    : Future.<Boolean>failedFuture(VfsException.fileExists(path)))
                            .recover(err -> err instanceof VfsException vfsError
                                    && vfsError.getCode() == VfsErrorCode.NOT_FOUND
                                    ? Future.succeededFuture(false)
                                    : Future.failedFuture(err))
                    : Future.succeededFuture(false);
            return skip
                    .compose(exists -> exists
                            ? Future.succeededFuture(ExitCode.SUCCESS)
                            : vfs.createDir(path, parents).map(v -> {
                                if (verbose) {
                                    context.out("mkdir: created directory '" + operand + "'\n");
                                }
                                return ExitCode.SUCCESS;
                            }))
                    .otherwise(err -> error(context, "cannot create directory '" + operand + "'", err));
        });
    }
}

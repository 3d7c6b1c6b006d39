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
import dev.mars.vconsole.vfs.DirEntry;
import dev.mars.vconsole.vfs.VfsPaths;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import io.vertx.core.Future;

import java.util.List;

/**
 * {@code cp [-rv] source... dest}. Copies into {@code dest} when it is a
 * directory; several sources require that.
 */
public final class CpCommand extends BaseCommand {

    public CpCommand() {
        super("cp", "Copy files and directories", "cp [-rv] SOURCE... DEST");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        List<String> operands = args.positional();
        if (operands.isEmpty()) {
            return Future.succeededFuture(usageError(context, "missing file operand"));
        }
        if (operands.size() == 1) {
            return Future.succeededFuture(
                    usageError(context, "missing destination file operand after '" + operands.get(0) + "'"));
        }
        boolean recursive = args.has("r", "R", "recursive");
        boolean verbose = args.has("v", "verbose");
        VirtualFileSystem vfs = context.getVfs();
        List<String> sources = operands.subList(0, operands.size() - 1);
        String destOperand = operands.get(operands.size() - 1);
        String dest = context.resolvePath(destOperand);

        return isDirectory(vfs, dest).compose(destIsDir -> {
            if (sources.size() > 1 && !destIsDir) {
                return fail(context, "target '" + destOperand + "' is not a directory");
            }
            return forEach(sources, operand -> {
                String source = context.resolvePath(operand);
                String target = destIsDir ? VfsPaths.join(dest, VfsPaths.basename(source)) : dest;
                return vfs.stat(source)
                        .compose(inode -> {
                            if (inode.isDirectory()) {
                                if (!recursive) {
                                    return fail(context, "-r not specified; omitting directory '" + operand + "'");
                                }
                                if (VfsPaths.isWithin(source, target)) {
                                    return fail(context, "cannot copy a directory, '" + operand
                                            + "', into itself, '" + target + "'");
                                }
                                return copyTree(vfs, source, target);
                            }
                            if (source.equals(target)) {
                                return fail(context, "'" + operand + "' and '" + destOperand + "' are the same file");
                            }
                            return copyFile(vfs, source, target);
                        })
                        .map(code -> {
                            if (verbose && code == ExitCode.SUCCESS) {
                                context.out("'" + operand + "' -> '" + target + "'\n");
                            }
                            return code;
                        })
                        .otherwise(err -> error(context, "cannot copy '" + operand + "'", err));
            });
        });
    }

    static Future<Boolean> isDirectory(VirtualFileSystem vfs, String path) {
        return vfs.stat(path)
                .map(inode -> inode.isDirectory())
                .recover(err -> err instanceof VfsException vfsError && vfsError.getCode() == VfsErrorCode.NOT_FOUND
                        ? Future.succeededFuture(false)
                        : Future.failedFuture(err));
    }

    private static Future<Integer> copyFile(VirtualFileSystem vfs, String source, String target) {
        return vfs.readFile(source)
                .compose(bytes -> vfs.writeFile(target, bytes))
                .map(v -> ExitCode.SUCCESS);
    }

    private static Future<Integer> copyTree(VirtualFileSystem vfs, String source, String target) {
        return isDirectory(vfs, target)
                .compose(exists -> exists ? Future.<Void>succeededFuture() : vfs.createDir(target))
                .compose(v -> vfs.readDir(source))
                .compose(entries -> {
                    Future<Integer> chain = Future.succeededFuture(ExitCode.SUCCESS);
                    for (DirEntry entry : entries) {
                        String from = VfsPaths.join(source, entry.name());
                        String to = VfsPaths.join(target, entry.name());
                        chain = chain.compose(code -> switch (entry.type()) {
                            case DIRECTORY -> copyTree(vfs, from, to);
                            case SYMLINK -> vfs.readlink(from).compose(link -> vfs.symlink(link, to))
                                    .map(done -> ExitCode.SUCCESS);
                            default -> copyFile(vfs, from, to);
                        });
                    }
                    return chain;
                });
    }
}

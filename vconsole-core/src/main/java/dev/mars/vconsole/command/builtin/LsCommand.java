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
import dev.mars.vconsole.vfs.DirEntry;
import dev.mars.vconsole.vfs.INode;
import dev.mars.vconsole.vfs.VfsPaths;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import io.vertx.core.Future;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * {@code ls [-laAhtr1] [path...]}: lists directory contents.
 */
public final class LsCommand extends BaseCommand {

    private static final DateTimeFormatter RECENT = DateTimeFormatter.ofPattern("MMM dd HH:mm", Locale.ENGLISH);
    private static final DateTimeFormatter OLDER = DateTimeFormatter.ofPattern("MMM dd  yyyy", Locale.ENGLISH);

    public LsCommand() {
        super("ls", "List directory contents", "ls [-laAhtr1] [FILE]...");
    }

    private record Listing(String name, INode inode) {
    }

    private record Options(boolean longFormat, boolean showHidden, boolean humanReadable,
                           boolean byTime, boolean reverse, boolean onePerLine) {
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        Options options = new Options(
                args.has("l"),
                args.has("a", "A", "all", "almost-all"),
                args.has("h", "human-readable"),
                args.has("t"),
                args.has("r", "reverse"),
                args.has("1"));
        List<String> operands = args.positional().isEmpty() ? List.of(".") : args.positional();
        boolean headers = operands.size() > 1;

        int[] printed = {0};
        return forEach(operands, operand -> {
            String path = context.resolvePath(operand);
            VirtualFileSystem vfs = context.getVfs();
            return vfs.stat(path)
                    .compose(inode -> {
                        if (!inode.isDirectory()) {
                            return vfs.lstat(path).map(own -> {
                                print(context, List.of(new Listing(operand, own)), options);
                                return ExitCode.SUCCESS;
                            });
                        }
                        return readListings(vfs, path, options).map(listings -> {
                            if (headers) {
                                context.out((printed[0]++ > 0 ? "\n" : "") + operand + ":\n");
                            }
                            print(context, listings, options);
                            return ExitCode.SUCCESS;
                        });
                    })
                    .otherwise(err -> error(context, "cannot access '" + operand + "'", err));
        });
    }

    private static Future<List<Listing>> readListings(VirtualFileSystem vfs, String dir, Options options) {
        return vfs.readDir(dir).compose(entries -> {
            List<Listing> listings = new ArrayList<>();
            Future<Void> chain = Future.succeededFuture();
            for (DirEntry entry : entries) {
                if (entry.name().startsWith(".") && !options.showHidden()) {
                    continue;
                }
                chain = chain.compose(v -> vfs.lstat(VfsPaths.join(dir, entry.name()))
                        .map(inode -> {
                            listings.add(new Listing(entry.name(), inode));
                            return null;
                        }));
            }
            return chain.map(v -> {
                Comparator<Listing> order = options.byTime()
                        ? Comparator.comparing((Listing l) -> l.inode().modifiedAt()).reversed()
                                .thenComparing(Listing::name)
                        : Comparator.comparing(Listing::name);
                listings.sort(options.reverse() ? order.reversed() : order);
                return listings;
            });
        });
    }

    private static void print(CommandContext context, List<Listing> listings, Options options) {
        if (listings.isEmpty()) {
            return;
        }
        StringBuilder out = new StringBuilder();
        if (options.longFormat()) {
            for (Listing listing : listings) {
                out.append(longEntry(listing, options.humanReadable())).append('\n');
            }
        } else if (options.onePerLine()) {
            listings.forEach(listing -> out.append(listing.name()).append('\n'));
        } else {
            List<String> names = new ArrayList<>();
            listings.forEach(listing -> names.add(listing.name()));
            out.append(String.join("  ", names)).append('\n');
        }
        context.out(out.toString());
    }

    private static String longEntry(Listing listing, boolean humanReadable) {
        INode inode = listing.inode();
        String size = humanReadable ? formatFileSize(inode.size()) : Long.toString(inode.size());
        String name = listing.name();
        if (inode.isSymlink() && inode.symlinkTarget() != null) {
            name += " -> " + inode.symlinkTarget();
        }
        return String.format("%s %3d %-8s %-8s %8s %s %s",
                formatPermissions(inode.type(), inode.mode()),
                inode.linkCount(),
                inode.owner(),
                inode.group(),
                size,
                formatDate(inode.modifiedAt()),
                name);
    }

    private static String formatDate(Instant instant) {
        ZonedDateTime time = instant.atZone(ZoneId.systemDefault());
        boolean thisYear = time.getYear() == ZonedDateTime.now(ZoneId.systemDefault()).getYear();
        return (thisYear ? RECENT : OLDER).format(time);
    }
}

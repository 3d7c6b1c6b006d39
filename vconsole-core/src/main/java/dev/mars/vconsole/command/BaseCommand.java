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

package dev.mars.vconsole.command;

import dev.mars.vconsole.core.exceptions.VfsException;
import dev.mars.vconsole.vfs.FileType;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Base class for built-in commands.
 *
 * <p>Handles {@code --help}/{@code -h}, splits arguments into flags, options
 * and operands, and provides the {@code name: message} error convention and
 * the formatting helpers shared by the file commands.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public abstract class BaseCommand implements CommandHandler {

    private final String name;
    private final String description;
    private final String usage;

    protected BaseCommand(String name, String description, String usage) {
        this.name = name;
        this.description = description;
        this.usage = usage;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CommandKind kind() {
        return CommandKind.BUILTIN;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public String usage() {
        return usage;
    }

    @Override
    public Future<Integer> execute(CommandContext context) {
        if (acceptsHelpFlag() && hasHelpFlag(context.getArgs())) {
            context.out(helpText());
            return Future.succeededFuture(ExitCode.SUCCESS);
        }
        return run(context, ParsedArgs.parse(context.getArgs()));
    }

    /**
     * Runs the command once help handling is done.
     */
    protected abstract Future<Integer> run(CommandContext context, ParsedArgs args);

    /**
     * Whether {@code -h}/{@code --help} prints the help text. Commands that
     * treat those arguments as data override this.
     */
    protected boolean acceptsHelpFlag() {
        return true;
    }

    public String helpText() {
        return name + " - " + description + "\n\nUsage: " + usage + "\n";
    }

    protected static boolean hasHelpFlag(List<String> args) {
        return args.contains("--help") || args.contains("-h");
    }

    /**
     * Writes {@code name: message} to stderr.
     *
     * @return {@link ExitCode#ERROR}
     */
    protected int error(CommandContext context, String message) {
        context.err(name + ": " + message + "\n");
        return ExitCode.ERROR;
    }

    protected Future<Integer> fail(CommandContext context, String message) {
        return Future.succeededFuture(error(context, message));
    }

    /**
     * Reports a filesystem failure for {@code operand} as
     * {@code name: operand: reason}.
     */
    protected int error(CommandContext context, String operand, Throwable cause) {
        String reason = cause instanceof VfsException vfs ? vfs.getReason() : String.valueOf(cause.getMessage());
        return error(context, operand + ": " + reason);
    }

    protected int usageError(CommandContext context, String message) {
        context.err(name + ": " + message + "\nUsage: " + usage + "\n");
        return ExitCode.MISUSE;
    }

    /**
     * Applies {@code action} to each item in order and completes with the
     * highest exit code seen.
     */
    protected static <T> Future<Integer> forEach(List<T> items, Function<T, Future<Integer>> action) {
        Future<Integer> chain = Future.succeededFuture(ExitCode.SUCCESS);
        for (T item : items) {
            chain = chain.compose(worst -> action.apply(item).map(code -> Math.max(worst, code)));
        }
        return chain;
    }

    /**
     * Formats a mode as {@code ls -l} does, for example {@code drwxr-xr-x}.
     */
    public static String formatPermissions(FileType type, int mode) {
        StringBuilder sb = new StringBuilder(10);
        sb.append(type.getListingChar());
        for (int shift = 6; shift >= 0; shift -= 3) {
            int bits = (mode >> shift) & 7;
            sb.append((bits & 4) != 0 ? 'r' : '-');
            sb.append((bits & 2) != 0 ? 'w' : '-');
            sb.append((bits & 1) != 0 ? 'x' : '-');
        }
        return sb.toString();
    }

    /**
     * Formats a byte count with a binary unit suffix: {@code 512B}, {@code 1.5K}.
     */
    public static String formatFileSize(long bytes) {
        String[] units = {"B", "K", "M", "G", "T"};
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < units.length - 1) {
            size /= 1024;
            unit++;
        }
        return unit == 0 ? bytes + units[0] : String.format(Locale.ROOT, "%.1f%s", size, units[unit]);
    }

    /**
     * Arguments split into single-letter and long flags, {@code --key=value}
     * options and operands. {@code --} ends option parsing and a lone
     * {@code -} is an operand.
     */
    public record ParsedArgs(Set<String> flags, Map<String, String> options, List<String> positional) {

        public static ParsedArgs parse(List<String> args) {
            Set<String> flags = new LinkedHashSet<>();
            Map<String, String> options = new LinkedHashMap<>();
            List<String> positional = new ArrayList<>();
            boolean operandsOnly = false;
            for (String arg : args) {
                if (operandsOnly || "-".equals(arg) || !arg.startsWith("-")) {
                    positional.add(arg);
                } else if ("--".equals(arg)) {
                    operandsOnly = true;
                } else if (arg.startsWith("--")) {
                    int equals = arg.indexOf('=');
                    if (equals > 2) {
                        options.put(arg.substring(2, equals), arg.substring(equals + 1));
                    } else {
                        flags.add(arg.substring(2));
                    }
                } else {
                    for (int i = 1; i < arg.length(); i++) {
                        flags.add(String.valueOf(arg.charAt(i)));
                    }
                }
            }
            return new ParsedArgs(flags, options, positional);
        }

        public boolean has(String... names) {
            for (String flag : names) {
                if (flags.contains(flag)) {
                    return true;
                }
            }
            return false;
        }

        public String option(String key, String defaultValue) {
            return options.getOrDefault(key, defaultValue);
        }
    }
}

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

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@code cat [-nbEsTA] [file...]}: concatenates files, or stdin when no file
 * or {@code -} is given.
 */
public final class CatCommand extends BaseCommand {

    public CatCommand() {
        super("cat", "Concatenate files and print on the standard output", "cat [OPTION]... [FILE]...");
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs args) {
        Options options = new Options(
                args.has("n", "number"),
                args.has("b", "number-nonblank"),
                args.has("E", "show-ends", "A", "show-all"),
                args.has("T", "show-tabs", "A", "show-all"),
                args.has("s", "squeeze-blank"));
        LineCounter counter = new LineCounter();
        List<String> operands = args.positional().isEmpty() ? List.of("-") : args.positional();

        return forEach(operands, operand -> {
            if ("-".equals(operand)) {
                emit(context, context.getStdin(), options, counter);
                return Future.succeededFuture(ExitCode.SUCCESS);
            }
            return context.getVfs().readFile(context.resolvePath(operand))
                    .map(bytes -> {
                        emit(context, bytes, options, counter);
                        return ExitCode.SUCCESS;
                    })
                    .otherwise(err -> error(context, operand, err));
        });
    }

    private static void emit(CommandContext context, byte[] bytes, Options options, LineCounter counter) {
        if (!options.transforms()) {
            context.out(bytes);
            return;
        }
        context.out(format(new String(bytes, StandardCharsets.UTF_8), options, counter));
    }

    static String format(String content, Options options, LineCounter counter) {
        if (content.isEmpty()) {
            return content;
        }
        boolean terminated = content.endsWith("\n");
        String[] lines = (terminated ? content.substring(0, content.length() - 1) : content).split("\n", -1);
        StringBuilder out = new StringBuilder(content.length() + lines.length * 8);
        boolean previousBlank = false;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            boolean blank = line.isEmpty();
            if (options.squeezeBlank() && blank && previousBlank) {
                continue;
            }
            previousBlank = blank;

            if (options.numberNonBlank()) {
                if (!blank) {
                    out.append(String.format("%6d\t", counter.next()));
                }
            } else if (options.number()) {
                out.append(String.format("%6d\t", counter.next()));
            }
            out.append(options.showTabs() ? line.replace("\t", "^I") : line);
            boolean hasNewline = i < lines.length - 1 || terminated;
            if (hasNewline) {
                out.append(options.showEnds() ? "$\n" : "\n");
            }
        }
        return out.toString();
    }

    record Options(boolean number, boolean numberNonBlank, boolean showEnds, boolean showTabs, boolean squeezeBlank) {

        boolean transforms() {
            return number || numberNonBlank || showEnds || showTabs || squeezeBlank;
        }
    }

    /**
     * Line numbers continue across operands.
     */
    static final class LineCounter {
        private int line;

        int next() {
            return ++line;
        }
    }
}

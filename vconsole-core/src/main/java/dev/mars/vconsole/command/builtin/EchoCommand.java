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

import java.util.List;

/**
 * {@code echo [-neE] [arg...]}: writes its arguments separated by spaces.
 */
public final class EchoCommand extends BaseCommand {

    public EchoCommand() {
        super("echo", "Display a line of text", "echo [-neE] [STRING]...");
    }

    @Override
    protected boolean acceptsHelpFlag() {
        return false;
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs ignored) {
        List<String> args = context.getArgs();
        boolean newline = true;
        boolean escapes = false;
        int index = 0;
        while (index < args.size() && isOptionWord(args.get(index))) {
            for (char c : args.get(index).substring(1).toCharArray()) {
                switch (c) {
                    case 'n' -> newline = false;
                    case 'e' -> escapes = true;
                    case 'E' -> escapes = false;
                }
            }
            index++;
        }

        String text = String.join(" ", args.subList(index, args.size()));
        if (escapes) {
            int stop = text.indexOf("\\c");
            if (stop >= 0) {
                text = text.substring(0, stop);
                newline = false;
            }
            text = interpretEscapes(text);
        }
        context.out(newline ? text + "\n" : text);
        return Future.succeededFuture(ExitCode.SUCCESS);
    }

    private static boolean isOptionWord(String arg) {
        return arg.length() > 1 && arg.charAt(0) == '-' && arg.substring(1).chars().allMatch(c -> "neE".indexOf(c) >= 0);
    }

    static String interpretEscapes(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                out.append(c);
                continue;
            }
            char next = text.charAt(++i);
            switch (next) {
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'e' -> out.append('\u001b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000b');
                case '\\' -> out.append('\\');
                case '0' -> i = appendCode(text, i + 1, 3, 8, out) - 1;
                case 'x' -> {
                    int end = appendCode(text, i + 1, 2, 16, out);
                    if (end == i + 1) {
                        out.append("\\x");
                    }
                    i = end - 1;
                }
                default -> out.append('\\').append(next);
            }
        }
        return out.toString();
    }

    /**
     * Appends the character encoded by up to {@code maxDigits} digits starting
     * at {@code start} and returns the index after the last digit consumed.
     */
    private static int appendCode(String text, int start, int maxDigits, int radix, StringBuilder out) {
        int end = start;
        while (end < text.length() && end - start < maxDigits && Character.digit(text.charAt(end), radix) >= 0) {
            end++;
        }
        if (end > start) {
            out.append((char) Integer.parseInt(text.substring(start, end), radix));
        } else if (radix == 8) {
            out.append('\0');
        }
        return end;
    }
}

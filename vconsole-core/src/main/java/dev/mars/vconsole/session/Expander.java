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

package dev.mars.vconsole.session;

import dev.mars.vconsole.lang.Word;
import dev.mars.vconsole.vfs.GlobMatcher;
import dev.mars.vconsole.vfs.VfsPaths;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Expands parsed words into command arguments.
 *
 * <p>Bare words go through tilde, variable, command substitution and glob
 * expansion in that order, each step working on the text produced by the
 * previous one, and finally lose their escaping backslashes. Double-quoted
 * words get variable and command substitution only; single-quoted words are
 * taken literally. Results are not split into fields.</p>
 *
 * <p>Supported forms: {@code ~}, {@code ~/path}, {@code $NAME},
 * {@code ${NAME}}, {@code ${NAME:-default}}, {@code $?}, {@code $(command)},
 * {@code `command`}, and {@code *}/{@code ?} wildcards matched against the
 * filesystem. A wildcard word with no match is kept as written.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public class Expander {

    /**
     * Variables and location a word is expanded in.
     */
    public record Scope(Map<String, String> environment, String workingDirectory, int lastExitCode) {

        String home() {
            return environment.getOrDefault("HOME", VfsPaths.ROOT);
        }
    }

    private final VirtualFileSystem vfs;
    private final Function<String, Future<String>> commandRunner;

    /**
     * @param vfs filesystem used for glob expansion
     * @param commandRunner runs the text of a command substitution and
     *        completes with its standard output
     */
    public Expander(VirtualFileSystem vfs, Function<String, Future<String>> commandRunner) {
        this.vfs = vfs;
        this.commandRunner = commandRunner;
    }

    public Future<List<String>> expandWords(List<Word> words, Scope scope) {
        List<String> result = new ArrayList<>();
        Future<Void> chain = Future.succeededFuture();
        for (Word word : words) {
            chain = chain.compose(v -> expandWord(word, scope)).map(expanded -> {
                result.addAll(expanded);
                return null;
            });
        }
        return chain.map(v -> result);
    }

    /**
     * Expands one word. Only a glob can produce more than one argument.
     */
    public Future<List<String>> expandWord(Word word, Scope scope) {
        switch (word.quoting()) {
            case SINGLE:
                return Future.succeededFuture(List.of(word.text()));
            case DOUBLE:
                return substituteCommands(substituteVariables(word.text(), scope, false), false).map(List::of);
            default:
                String text = substituteVariables(expandTilde(word.text(), scope), scope, true);
                return substituteCommands(text, true).compose(substituted -> glob(substituted, scope));
        }
    }

    /**
     * Expands an assignment value or a redirection target: everything a bare
     * word gets except globbing.
     */
    public Future<String> expandValue(String value, Scope scope) {
        String text = substituteVariables(expandTilde(value, scope), scope, true);
        return substituteCommands(text, true).map(Expander::unescape);
    }

    static String expandTilde(String text, Scope scope) {
        if ("~".equals(text)) {
            return escape(scope.home());
        }
        if (text.startsWith("~/")) {
            return escape(scope.home()) + text.substring(1);
        }
        return text;
    }

    /**
     * Replaces variable references. Command substitutions are copied through
     * untouched so that their text is expanded when the command runs.
     */
    static String substituteVariables(String text, Scope scope, boolean escapeValues) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                out.append(c).append(text.charAt(i + 1));
                i += 2;
            } else if (c == '`') {
                int end = text.indexOf('`', i + 1);
                end = end < 0 ? text.length() : end + 1;
                out.append(text, i, end);
                i = end;
            } else if (c == '$' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == '(') {
                    int end = closingParen(text, i + 1);
                    out.append(text, i, end);
                    i = end;
                } else if (next == '{') {
                    int close = text.indexOf('}', i + 2);
                    if (close < 0) {
                        out.append(text, i, text.length());
                        i = text.length();
                    } else {
                        String value = braced(text.substring(i + 2, close), scope);
                        out.append(escapeValues ? escape(value) : value);
                        i = close + 1;
                    }
                } else if (next == '?') {
                    out.append(scope.lastExitCode());
                    i += 2;
                } else if (isIdentifierStart(next)) {
                    int end = i + 1;
                    while (end < text.length() && isIdentifierPart(text.charAt(end))) {
                        end++;
                    }
                    String value = scope.environment().getOrDefault(text.substring(i + 1, end), "");
                    out.append(escapeValues ? escape(value) : value);
                    i = end;
                } else {
                    out.append(c);
                    i++;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static String braced(String expression, Scope scope) {
        int fallback = expression.indexOf(":-");
        String name = fallback >= 0 ? expression.substring(0, fallback) : expression;
        if ("?".equals(name)) {
            return Integer.toString(scope.lastExitCode());
        }
        String value = scope.environment().get(name);
        if (fallback >= 0 && (value == null || value.isEmpty())) {
            return expression.substring(fallback + 2);
        }
        return value == null ? "" : value;
    }

    private Future<String> substituteCommands(String text, boolean escapeValues) {
        List<Object> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                literal.append(c).append(text.charAt(i + 1));
                i += 2;
            } else if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '(') {
                int end = closingParen(text, i + 1);
                parts.add(literal.toString());
                literal.setLength(0);
                parts.add(new Substitution(text.substring(i + 2, Math.max(i + 2, end - 1))));
                i = end;
            } else if (c == '`') {
                int close = text.indexOf('`', i + 1);
                int end = close < 0 ? text.length() : close;
                parts.add(literal.toString());
                literal.setLength(0);
                parts.add(new Substitution(text.substring(i + 1, end)));
                i = close < 0 ? text.length() : close + 1;
            } else {
                literal.append(c);
                i++;
            }
        }
        parts.add(literal.toString());
        if (parts.size() == 1) {
            return Future.succeededFuture(text);
        }

        StringBuilder out = new StringBuilder();
        Future<Void> chain = Future.succeededFuture();
        for (Object part : parts) {
            if (part instanceof Substitution substitution) {
                chain = chain.compose(v -> commandRunner.apply(substitution.command()))
                        .map(output -> {
                            String trimmed = stripTrailingNewlines(output);
                            out.append(escapeValues ? escape(trimmed) : trimmed);
                            return null;
                        });
            } else {
                chain = chain.map(v -> {
                    out.append((String) part);
                    return null;
                });
            }
        }
        return chain.map(v -> out.toString());
    }

    private record Substitution(String command) {
    }

    private Future<List<String>> glob(String text, Scope scope) {
        if (!GlobMatcher.hasWildcard(text)) {
            return Future.succeededFuture(List.of(unescape(text)));
        }
        boolean absolute = text.startsWith("/");
        String cwd = scope.workingDirectory();
        String pattern = absolute ? text : escapeGlob(cwd) + "/" + text;
        return vfs.glob(pattern, cwd).map(matches -> {
            if (matches.isEmpty()) {
                return List.of(unescape(text));
            }
            List<String> result = new ArrayList<>(matches.size());
            for (String match : matches) {
                result.add(absolute ? match : VfsPaths.relativize(cwd, match));
            }
            return result;
        });
    }

    private static int closingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i + 1;
            }
        }
        return text.length();
    }

    private static String stripTrailingNewlines(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(0, end);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    /**
     * Protects inserted text from the later unescape step.
     */
    static String escape(String value) {
        return value.replace("\\", "\\\\");
    }

    private static String escapeGlob(String path) {
        StringBuilder out = new StringBuilder(path.length());
        for (char c : path.toCharArray()) {
            if (c == '*' || c == '?' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    static String unescape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                out.append(text.charAt(++i));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}

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

package dev.mars.vconsole.vfs;

import java.util.regex.Pattern;

/**
 * Reduced wildcard matcher supporting {@code *} and {@code ?}. A backslash
 * makes the next character literal.
 *
 * <p>Patterns containing a {@code /} are matched against whole absolute paths,
 * with wildcards confined to a single segment. Other patterns are matched
 * against entry names.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class GlobMatcher {

    private final String glob;
    private final Pattern pattern;
    private final boolean pathPattern;

    private GlobMatcher(String glob, Pattern pattern, boolean pathPattern) {
        this.glob = glob;
        this.pattern = pattern;
        this.pathPattern = pathPattern;
    }

    public static GlobMatcher compile(String glob) {
        boolean pathPattern = glob.indexOf('/') >= 0;
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                literal.append(glob.charAt(++i));
            } else if (c == '*' || c == '?') {
                flush(regex, literal);
                if (c == '*') {
                    regex.append(pathPattern ? "[^/]*" : ".*");
                } else {
                    regex.append(pathPattern ? "[^/]" : ".");
                }
            } else {
                literal.append(c);
            }
        }
        flush(regex, literal);
        regex.append('$');
        return new GlobMatcher(glob, Pattern.compile(regex.toString()), pathPattern);
    }

    /**
     * Returns true if the text contains an unescaped wildcard.
     */
    public static boolean hasWildcard(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '*' || c == '?') {
                return true;
            }
        }
        return false;
    }

    public boolean matches(String fullPath, String name) {
        return pathPattern ? pattern.matcher(fullPath).matches() : pattern.matcher(name).matches();
    }

    public boolean isPathPattern() {
        return pathPattern;
    }

    /**
     * Returns the directory depth a path pattern can match at, or -1 for name patterns.
     */
    public int depth() {
        if (!pathPattern) {
            return -1;
        }
        return (int) glob.chars().filter(c -> c == '/').count();
    }

    private static void flush(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    @Override
    public String toString() {
        return "GlobMatcher{" + glob + '}';
    }
}

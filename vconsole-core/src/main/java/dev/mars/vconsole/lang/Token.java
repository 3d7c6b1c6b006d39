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

package dev.mars.vconsole.lang;

/**
 * Immutable, positional lexer token.
 *
 * @param type the token kind
 * @param value the token text (for quoted strings, the unquoted content)
 * @param position zero-based offset of the first character, counted in UTF-16 chars
 *                 (a {@code String} index into the input), not in encoded bytes
 * @param line one-based line number
 * @param column one-based column number
 * @param quote the opening quote character of a {@link TokenType#STRING}, otherwise {@code 0}
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record Token(TokenType type, String value, int position, int line, int column, char quote) {

    public Token(TokenType type, String value, int position, int line, int column) {
        this(type, value, position, line, column, (char) 0);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isSingleQuoted() {
        return type == TokenType.STRING && quote == '\'';
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + line + ":" + column;
    }
}

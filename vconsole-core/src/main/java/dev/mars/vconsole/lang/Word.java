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
 * A command argument as written, before expansion.
 *
 * @param text the argument text
 * @param quoting how the argument was quoted, which decides the expansions applied to it
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record Word(String text, Quoting quoting) {

    public enum Quoting {
        /** Bare word: tilde, variable, command substitution and glob expansion. */
        NONE,
        /** Double-quoted: variable and command substitution only. */
        DOUBLE,
        /** Single-quoted: taken literally. */
        SINGLE
    }

    public static Word bare(String text) {
        return new Word(text, Quoting.NONE);
    }

    static Word of(Token token) {
        if (token.type() != TokenType.STRING) {
            return new Word(token.value(), Quoting.NONE);
        }
        return new Word(token.value(), token.isSingleQuoted() ? Quoting.SINGLE : Quoting.DOUBLE);
    }
}

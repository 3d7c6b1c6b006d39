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
 * Token kinds produced by the {@link Lexer}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum TokenType {
    WORD,
    STRING,
    PIPE,
    REDIRECT_OUT,
    REDIRECT_APPEND,
    REDIRECT_IN,
    REDIRECT_ERR,
    REDIRECT_ERR_APPEND,
    BACKGROUND,
    SEMICOLON,
    AND,
    OR,
    SUBSHELL_OPEN,
    SUBSHELL_CLOSE,
    VARIABLE,
    ASSIGNMENT,
    NEWLINE,
    EOF;

    public boolean isRedirection() {
        return this == REDIRECT_OUT || this == REDIRECT_APPEND || this == REDIRECT_IN
                || this == REDIRECT_ERR || this == REDIRECT_ERR_APPEND;
    }

    /**
     * Returns true for tokens that end a pipeline segment.
     */
    public boolean isSegmentTerminator() {
        return this == PIPE || this == BACKGROUND || this == SEMICOLON || this == AND
                || this == OR || this == NEWLINE || this == EOF;
    }

    /**
     * Returns true for tokens that separate commands in a command list.
     */
    public boolean isListSeparator() {
        return this == SEMICOLON || this == AND || this == OR || this == NEWLINE;
    }
}

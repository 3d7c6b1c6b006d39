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

package dev.mars.vconsole.core.exceptions;

import dev.mars.vconsole.lang.Token;

/**
 * Exception thrown when command input cannot be parsed.
 * Carries the offending token and its position in the input text.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ParseException extends ShellException {

    private final Token token;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    public int getPosition() {
        return token != null ? token.position() : -1;
    }

    public int getLine() {
        return token != null ? token.line() : -1;
    }

    public int getColumn() {
        return token != null ? token.column() : -1;
    }

    /**
     * Returns the bare message without position information.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (token == null) {
            return "Parse error: " + super.getMessage();
        }
        return String.format("Parse error at line %d, column %d: %s",
                token.line(), token.column(), super.getMessage());
    }
}

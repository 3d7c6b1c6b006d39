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
 * Stream redirection kinds and the descriptor each one reroutes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum RedirectionType {
    INPUT(0, "<"),
    OUTPUT(1, ">"),
    APPEND(1, ">>"),
    ERROR(2, "2>"),
    ERROR_APPEND(2, "2>>");

    private final int sourceDescriptor;
    private final String operator;

    RedirectionType(int sourceDescriptor, String operator) {
        this.sourceDescriptor = sourceDescriptor;
        this.operator = operator;
    }

    public int getSourceDescriptor() {
        return sourceDescriptor;
    }

    public String getOperator() {
        return operator;
    }

    public boolean isAppend() {
        return this == APPEND || this == ERROR_APPEND;
    }

    static RedirectionType fromToken(TokenType type) {
        return switch (type) {
            case REDIRECT_OUT -> OUTPUT;
            case REDIRECT_APPEND -> APPEND;
            case REDIRECT_IN -> INPUT;
            case REDIRECT_ERR -> ERROR;
            case REDIRECT_ERR_APPEND -> ERROR_APPEND;
            default -> throw new IllegalArgumentException("Not a redirection token: " + type);
        };
    }
}

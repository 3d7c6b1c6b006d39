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

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw command input into a flat token stream.
 *
 * <p>The lexer never fails. Malformed input such as an unterminated quote is
 * turned into best-effort tokens and left for the {@link Parser} to reject.
 * Variables, command substitutions and globs are kept verbatim; expansion
 * happens at execution time.</p>
 *
 * <p>Inside a bare word, a backslash escapes the next character. Escaped
 * characters that carry meaning for expansion ({@code $ ` * ? ~ \}) are kept with
 * their backslash so that the expander treats them literally, and the same
 * applies to quoted sections embedded in a word ({@code --name="a b"}).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class Lexer {

    private static final String DELIMITERS = "|><&;()\n#";
    private static final String EXPANSION_CHARS = "$`*?~\\";

    private final String input;
    private int position;
    private int line = 1;
    private int column = 1;

    public Lexer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * Convenience for {@code new Lexer(input).tokenize()}.
     */
    public static List<Token> tokenize(String input) {
        return new Lexer(input).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        while ((token = nextToken()) != null) {
            tokens.add(token);
        }
        tokens.add(new Token(TokenType.EOF, "", position, line, column));
        return tokens;
    }

    private Token nextToken() {
        skipWhitespace();
        if (isAtEnd()) {
            return null;
        }
        if (current() == '#') {
            skipComment();
            return nextToken();
        }

        int start = position;
        int startLine = line;
        int startColumn = column;
        char c = current();

        switch (c) {
            case '\n':
                advance();
                return new Token(TokenType.NEWLINE, "\n", start, startLine, startColumn);
            case '"':
            case '\'':
                return readString(start, startLine, startColumn);
            case '|':
                return operator(peek() == '|' ? TokenType.OR : TokenType.PIPE, start, startLine, startColumn);
            case '&':
                return operator(peek() == '&' ? TokenType.AND : TokenType.BACKGROUND, start, startLine, startColumn);
            case '>':
                return operator(peek() == '>' ? TokenType.REDIRECT_APPEND : TokenType.REDIRECT_OUT,
                        start, startLine, startColumn);
            case '<':
                return operator(TokenType.REDIRECT_IN, start, startLine, startColumn);
            case ';':
                return operator(TokenType.SEMICOLON, start, startLine, startColumn);
            case '(':
                return operator(TokenType.SUBSHELL_OPEN, start, startLine, startColumn);
            case ')':
                return operator(TokenType.SUBSHELL_CLOSE, start, startLine, startColumn);
            default:
                break;
        }

        if (c == '2' && peek() == '>') {
            advance();
            advance();
            if (!isAtEnd() && current() == '>') {
                advance();
                return new Token(TokenType.REDIRECT_ERR_APPEND, "2>>", start, startLine, startColumn);
            }
            return new Token(TokenType.REDIRECT_ERR, "2>", start, startLine, startColumn);
        }

        if (c == '$' && peek() != '(') {
            return readVariable(start, startLine, startColumn);
        }

        return readWord(start, startLine, startColumn, new StringBuilder());
    }

    private Token operator(TokenType type, int start, int startLine, int startColumn) {
        int length = switch (type) {
            case OR, AND, REDIRECT_APPEND -> 2;
            default -> 1;
        };
        for (int i = 0; i < length; i++) {
            advance();
        }
        return new Token(type, input.substring(start, start + length), start, startLine, startColumn);
    }

    private Token readString(int start, int startLine, int startColumn) {
        char quote = current();
        advance();
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && current() != quote) {
            if (current() == '\\' && peek() == quote) {
                advance();
            }
            value.append(current());
            advance();
        }
        if (!isAtEnd()) {
            advance();
        }
        return new Token(TokenType.STRING, value.toString(), start, startLine, startColumn, quote);
    }

    private Token readVariable(int start, int startLine, int startColumn) {
        StringBuilder value = new StringBuilder("$");
        advance();
        if (!isAtEnd() && current() == '{') {
            while (!isAtEnd() && current() != '}') {
                value.append(current());
                advance();
            }
            if (!isAtEnd()) {
                value.append('}');
                advance();
            }
        } else if (!isAtEnd() && current() == '?') {
            value.append('?');
            advance();
        } else {
            while (!isAtEnd() && isVariableChar(current())) {
                value.append(current());
                advance();
            }
        }

        // $HOME/docs is one argument: continue as a word
        if (!isAtEnd() && !isWhitespace(current()) && !isDelimiter(current())) {
            return readWord(start, startLine, startColumn, value);
        }
        return new Token(TokenType.VARIABLE, value.toString(), start, startLine, startColumn);
    }

    private Token readWord(int start, int startLine, int startColumn, StringBuilder value) {
        while (!isAtEnd() && !isWhitespace(current()) && !isDelimiter(current())) {
            char c = current();
            if (c == '=' && value.length() > 0 && isValidIdentifier(value) && start == position - value.length()) {
                value.append('=');
                advance();
                readWordChars(value);
                return new Token(TokenType.ASSIGNMENT, value.toString(), start, startLine, startColumn);
            }
            readWordChar(value);
        }
        return new Token(TokenType.WORD, value.toString(), start, startLine, startColumn);
    }

    private void readWordChars(StringBuilder value) {
        while (!isAtEnd() && !isWhitespace(current()) && !isDelimiter(current())) {
            readWordChar(value);
        }
    }

    private void readWordChar(StringBuilder value) {
        char c = current();
        if (c == '\\' && position + 1 < input.length()) {
            advance();
            char escaped = current();
            if (EXPANSION_CHARS.indexOf(escaped) >= 0) {
                value.append('\\');
            }
            value.append(escaped);
            advance();
        } else if (c == '$' && peek() == '(') {
            readCommandSubstitution(value);
        } else if (c == '`') {
            readBackquoted(value);
        } else if (c == '"' || c == '\'') {
            readEmbeddedQuote(value, c);
        } else {
            value.append(c);
            advance();
        }
    }

    private void readCommandSubstitution(StringBuilder value) {
        int depth = 0;
        while (!isAtEnd()) {
            char c = current();
            value.append(c);
            advance();
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return;
                }
            }
        }
    }

    private void readBackquoted(StringBuilder value) {
        value.append('`');
        advance();
        while (!isAtEnd() && current() != '`') {
            value.append(current());
            advance();
        }
        if (!isAtEnd()) {
            value.append('`');
            advance();
        }
    }

    private void readEmbeddedQuote(StringBuilder value, char quote) {
        String literal = quote == '\'' ? EXPANSION_CHARS : "*?~";
        advance();
        while (!isAtEnd() && current() != quote) {
            if (current() == '\\' && peek() == quote) {
                advance();
            }
            char c = current();
            if (literal.indexOf(c) >= 0) {
                value.append('\\');
            }
            value.append(c);
            advance();
        }
        if (!isAtEnd()) {
            advance();
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(current())) {
            advance();
        }
    }

    private void skipComment() {
        while (!isAtEnd() && current() != '\n') {
            advance();
        }
    }

    private void advance() {
        if (isAtEnd()) {
            return;
        }
        if (input.charAt(position) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position++;
    }

    private char current() {
        return input.charAt(position);
    }

    private char peek() {
        return position + 1 < input.length() ? input.charAt(position + 1) : '\0';
    }

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r';
    }

    private static boolean isDelimiter(char c) {
        return DELIMITERS.indexOf(c) >= 0;
    }

    private static boolean isVariableChar(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isValidIdentifier(CharSequence name) {
        if (name.length() == 0) {
            return false;
        }
        if (!isIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isVariableChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}

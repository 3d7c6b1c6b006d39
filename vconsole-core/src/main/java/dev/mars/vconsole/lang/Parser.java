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

import dev.mars.vconsole.core.exceptions.ParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link ParsedCommand} from a token stream.
 *
 * <p>Grammar (one pipeline):</p>
 * <pre>
 * command  := assignment* [ segment ( '|' segment )* [ '&amp;' ] ] EOF
 * segment  := assignment* name ( assignment | redirection | argument )*
 * redirect := ( '&gt;' | '&gt;&gt;' | '&lt;' | '2&gt;' | '2&gt;&gt;' ) ( target | '&amp;' fd )
 * </pre>
 *
 * <p>Parsing fails closed: trailing tokens after a complete pipeline are an
 * error rather than being ignored. Expansion of arguments is left to the
 * execution layer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class Parser {

    private final List<Token> tokens;
    private int position;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            List<Token> terminated = new ArrayList<>(tokens);
            int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).position() + 1;
            terminated.add(new Token(TokenType.EOF, "", end, 1, end + 1));
            this.tokens = terminated;
        } else {
            this.tokens = tokens;
        }
    }

    public static ParsedCommand parse(String input) throws ParseException {
        return new Parser(Lexer.tokenize(input)).parse();
    }

    /**
     * Parses input that may hold several pipelines joined by {@code ;},
     * newlines, {@code &&} or {@code ||}.
     */
    public static CommandList parseList(String input) throws ParseException {
        return new Parser(Lexer.tokenize(input)).parseList();
    }

    public ParsedCommand parse() throws ParseException {
        ParsedCommand command = parsePipeline();
        expectEnd();
        return command;
    }

    public CommandList parseList() throws ParseException {
        List<CommandList.Entry> entries = new ArrayList<>();
        CommandList.Connector connector = CommandList.Connector.ALWAYS;
        Token connectorToken = null;

        while (true) {
            skipStatementSeparators(connector);
            if (current().is(TokenType.EOF)) {
                if (connector != CommandList.Connector.ALWAYS) {
                    throw new ParseException("Expected command after '" + connectorToken.value() + "'", current());
                }
                break;
            }
            ParsedCommand command = parsePipeline();
            Token separator = current();
            if (command.isEmpty() && command.environment().isEmpty()) {
                throw new ParseException("Unexpected token '" + separator.value() + "'", separator);
            }
            entries.add(new CommandList.Entry(connector, command));

            switch (separator.type()) {
                case EOF -> {
                    return new CommandList(entries);
                }
                case AND -> connector = CommandList.Connector.AND;
                case OR -> connector = CommandList.Connector.OR;
                case SEMICOLON, NEWLINE -> connector = CommandList.Connector.ALWAYS;
                default -> throw new ParseException("Unexpected token at end of input", separator);
            }
            connectorToken = separator;
            advance();
        }
        return new CommandList(entries);
    }

    private void skipStatementSeparators(CommandList.Connector pending) {
        // a newline may follow && or ||, a bare ';' may not start a command
        while (current().is(TokenType.NEWLINE)
                || (current().is(TokenType.SEMICOLON) && pending == CommandList.Connector.ALWAYS)) {
            advance();
        }
    }

    private ParsedCommand parsePipeline() throws ParseException {
        Map<String, String> environment = new LinkedHashMap<>();
        while (current().is(TokenType.ASSIGNMENT)) {
            putAssignment(environment, current());
            advance();
        }

        List<PipelineSegment> segments = new ArrayList<>();
        boolean background = false;
        if (!atPipelineEnd()) {
            segments.add(parseSegment());
            while (current().is(TokenType.PIPE)) {
                advance();
                segments.add(parseSegment());
            }
            if (current().is(TokenType.BACKGROUND)) {
                background = true;
                advance();
            }
        }
        return new ParsedCommand(segments, background, environment);
    }

    private PipelineSegment parseSegment() throws ParseException {
        Map<String, String> environment = new LinkedHashMap<>();
        while (current().is(TokenType.ASSIGNMENT)) {
            putAssignment(environment, current());
            advance();
        }

        Token name = current();
        if (!name.is(TokenType.WORD) && !name.is(TokenType.STRING)) {
            throw new ParseException("Expected command name", name);
        }
        advance();

        List<Word> words = new ArrayList<>();
        List<Redirection> redirections = new ArrayList<>();

        while (!current().type().isSegmentTerminator()) {
            Token token = current();
            if (token.type().isRedirection()) {
                redirections.add(parseRedirection());
            } else if (token.is(TokenType.ASSIGNMENT)) {
                // segment-local, and still visible to the command as an argument (export A=1)
                putAssignment(environment, token);
                words.add(Word.of(token));
                advance();
            } else if (token.is(TokenType.WORD) || token.is(TokenType.STRING) || token.is(TokenType.VARIABLE)) {
                words.add(Word.of(token));
                advance();
            } else {
                break;
            }
        }
        return new PipelineSegment(name.value(), words, redirections, environment);
    }

    private Redirection parseRedirection() throws ParseException {
        RedirectionType type = RedirectionType.fromToken(current().type());
        Token operator = current();
        advance();

        Token target = current();
        if (target.is(TokenType.BACKGROUND) && isAdjacent(operator, target)) {
            // 2>&1
            advance();
            Token descriptor = current();
            Integer fd = isAdjacent(target, descriptor) ? parseDescriptor(descriptor) : null;
            if (fd == null) {
                throw new ParseException("Expected file descriptor", descriptor);
            }
            advance();
            return Redirection.toDescriptor(type, fd);
        }
        if (!target.is(TokenType.WORD) && !target.is(TokenType.STRING)) {
            throw new ParseException("Expected redirection target", target);
        }
        advance();

        Integer fd = target.is(TokenType.WORD) ? parseDescriptor(target) : null;
        return fd != null ? Redirection.toDescriptor(type, fd) : Redirection.toFile(type, target.value());
    }

    private static Integer parseDescriptor(Token token) {
        if (!token.is(TokenType.WORD) || token.value().isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(token.value());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isAdjacent(Token first, Token second) {
        return first.position() + first.value().length() == second.position();
    }

    private static void putAssignment(Map<String, String> environment, Token token) throws ParseException {
        String assignment = token.value();
        int equals = assignment.indexOf('=');
        if (equals <= 0) {
            throw new ParseException("Invalid assignment syntax", token);
        }
        environment.put(assignment.substring(0, equals), assignment.substring(equals + 1));
    }

    private void expectEnd() throws ParseException {
        if (!current().is(TokenType.EOF)) {
            throw new ParseException("Unexpected token at end of input", current());
        }
    }

    private boolean atPipelineEnd() {
        TokenType type = current().type();
        return type == TokenType.EOF || type.isListSeparator();
    }

    private Token current() {
        return tokens.get(position);
    }

    private void advance() {
        if (position < tokens.size() - 1) {
            position++;
        }
    }
}

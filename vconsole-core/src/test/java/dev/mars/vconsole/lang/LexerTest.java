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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
class LexerTest {

    private static List<TokenType> types(String input) {
        return Lexer.tokenize(input).stream().map(Token::type).toList();
    }

    private static List<String> values(String input) {
        return Lexer.tokenize(input).stream().map(Token::value).toList();
    }

    @Test
    void testEmptyInputYieldsOnlyEof() {
        assertEquals(List.of(TokenType.EOF), types(""));
        assertEquals(List.of(TokenType.EOF), types("   \t "));
        assertEquals(List.of(TokenType.EOF), types(null));
    }

    @Test
    void testWordsAreSplitOnWhitespace() {
        assertEquals(List.of("ls", "-la", "/tmp", ""), values("ls   -la\t/tmp"));
        assertEquals(List.of(TokenType.WORD, TokenType.WORD, TokenType.WORD, TokenType.EOF), types("ls -la /tmp"));
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        void testPipeAndLogicalOperators() {
            assertEquals(List.of(TokenType.WORD, TokenType.PIPE, TokenType.WORD, TokenType.AND, TokenType.WORD,
                    TokenType.OR, TokenType.WORD, TokenType.EOF), types("a | b && c || d"));
        }

        @Test
        void testOperatorsNeedNoSurroundingSpace() {
            assertEquals(List.of(TokenType.WORD, TokenType.PIPE, TokenType.WORD, TokenType.SEMICOLON,
                    TokenType.WORD, TokenType.EOF), types("a|b;c"));
        }

        @Test
        void testRedirections() {
            assertEquals(List.of(TokenType.WORD, TokenType.REDIRECT_OUT, TokenType.WORD,
                    TokenType.REDIRECT_APPEND, TokenType.WORD, TokenType.REDIRECT_IN, TokenType.WORD,
                    TokenType.REDIRECT_ERR, TokenType.WORD, TokenType.REDIRECT_ERR_APPEND, TokenType.WORD,
                    TokenType.EOF), types("cmd > a >> b < c 2> d 2>> e"));
        }

        @Test
        void testBackgroundAndSubshellTokens() {
            assertEquals(List.of(TokenType.SUBSHELL_OPEN, TokenType.WORD, TokenType.SUBSHELL_CLOSE,
                    TokenType.BACKGROUND, TokenType.EOF), types("(sleep) &"));
        }

        @Test
        void testNewlineIsAToken() {
            assertEquals(List.of(TokenType.WORD, TokenType.NEWLINE, TokenType.WORD, TokenType.EOF), types("a\nb"));
        }
    }

    @Nested
    @DisplayName("Quoting")
    class Quoting {

        @Test
        void testDoubleQuotedStringKeepsSpaces() {
            List<Token> tokens = Lexer.tokenize("echo \"hello   world\"");
            assertEquals(TokenType.STRING, tokens.get(1).type());
            assertEquals("hello   world", tokens.get(1).value());
            assertFalse(tokens.get(1).isSingleQuoted());
        }

        @Test
        void testSingleQuotedStringIsMarked() {
            Token token = Lexer.tokenize("'$HOME'").get(0);
            assertEquals("$HOME", token.value());
            assertTrue(token.isSingleQuoted());
        }

        @Test
        void testEscapedQuoteInsideString() {
            assertEquals("say \"hi\"", Lexer.tokenize("\"say \\\"hi\\\"\"").get(0).value());
        }

        @Test
        void testUnterminatedStringDoesNotThrow() {
            List<Token> tokens = Lexer.tokenize("echo \"open");
            assertEquals(TokenType.STRING, tokens.get(1).type());
            assertEquals("open", tokens.get(1).value());
        }

        @Test
        void testEmbeddedQuotesJoinTheWord() {
            Token token = Lexer.tokenize("--name=\"a b\"").get(0);
            assertEquals(TokenType.WORD, token.type());
            assertEquals("--name=a b", token.value());
        }

        @Test
        void testEscapedWildcardKeepsBackslash() {
            assertEquals("\\*.txt", Lexer.tokenize("\\*.txt").get(0).value());
            assertEquals("a b", Lexer.tokenize("a\\ b").get(0).value());
        }
    }

    @Nested
    @DisplayName("Variables and assignments")
    class Variables {

        @Test
        void testStandaloneVariable() {
            Token token = Lexer.tokenize("echo $HOME").get(1);
            assertEquals(TokenType.VARIABLE, token.type());
            assertEquals("$HOME", token.value());
        }

        @Test
        void testBracedVariableAndExitStatus() {
            assertEquals(List.of("${X:-d}", "$?", ""), values("${X:-d} $?"));
        }

        @Test
        void testVariableFollowedByTextIsAWord() {
            Token token = Lexer.tokenize("$HOME/docs").get(0);
            assertEquals(TokenType.WORD, token.type());
            assertEquals("$HOME/docs", token.value());
        }

        @Test
        void testAssignment() {
            Token token = Lexer.tokenize("FOO=bar").get(0);
            assertEquals(TokenType.ASSIGNMENT, token.type());
            assertEquals("FOO=bar", token.value());
        }

        @Test
        void testEqualsAfterInvalidIdentifierIsAWord() {
            assertEquals(TokenType.WORD, Lexer.tokenize("1A=b").get(0).type());
            assertEquals(TokenType.WORD, Lexer.tokenize("--opt=b").get(0).type());
        }

        @Test
        void testCommandSubstitutionStaysInOneWord() {
            List<Token> tokens = Lexer.tokenize("echo $(ls | wc) `date`");
            assertEquals("$(ls | wc)", tokens.get(1).value());
            assertEquals("`date`", tokens.get(2).value());
        }
    }

    @Test
    void testCommentsAreSkipped() {
        assertEquals(List.of("echo", "hi", ""), values("echo hi # a comment"));
    }

    @Test
    void testPositionsAreTracked() {
        List<Token> tokens = Lexer.tokenize("ls\n  cat");
        Token cat = tokens.get(2);
        assertEquals(2, cat.line());
        assertEquals(3, cat.column());
        assertEquals(5, cat.position());
    }

    @Test
    void testPositionsCountCharactersNotBytes() {
        List<Token> tokens = Lexer.tokenize("echo é | cat");
        assertEquals(7, tokens.get(2).position());
        assertEquals(9, tokens.get(3).position());
        assertEquals(10, tokens.get(3).column());
    }

    @Test
    void testPipelineWithRedirection() {
        assertEquals(List.of(TokenType.WORD, TokenType.WORD, TokenType.PIPE, TokenType.WORD, TokenType.WORD,
                TokenType.REDIRECT_OUT, TokenType.WORD, TokenType.EOF), types("ls -la | grep foo > out.txt"));
        assertEquals(List.of("ls", "-la", "|", "grep", "foo", ">", "out.txt", ""),
                values("ls -la | grep foo > out.txt"));
    }
}

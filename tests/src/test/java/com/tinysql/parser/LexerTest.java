package com.tinysql.parser;

import com.tinysql.exception.LexException;
import com.tinysql.test.TestBase;
import com.tinysql.test.TestCategories;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit tests for {@link Lexer}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Lexer Tests")
public class LexerTest extends TestBase {

    private static List<Token> tokenize(String input) {
        Lexer lexer = new Lexer(input);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    private static List<TokenType> types(String input) {
        return tokenize(input).stream().map(Token::type).toList();
    }

    @Nested
    @DisplayName("Keywords and Identifiers")
    class KeywordTests {

        @Test
        @DisplayName("Lower-case keywords are recognized with positions")
        void testLowerCaseKeywords() {
            List<Token> tokens = tokenize("select a");

            assertThat(tokens).containsExactly(
                new Token(TokenType.SELECT, "select", 0),
                new Token(TokenType.WHITESPACE, " ", 6),
                new Token(TokenType.IDENTIFIER, "a", 7),
                new Token(TokenType.EOF, "", 8));
        }

        @Test
        @DisplayName("Upper-case keywords are recognized")
        void testUpperCaseKeywords() {
            assertThat(types("SELECT col1 FROM table1")).containsExactly(
                TokenType.SELECT, TokenType.WHITESPACE, TokenType.IDENTIFIER,
                TokenType.WHITESPACE, TokenType.FROM, TokenType.WHITESPACE,
                TokenType.IDENTIFIER, TokenType.EOF);
        }

        @ParameterizedTest
        @ValueSource(strings = {"Select", "sElEcT", "selects", "from_t", "_x", "col1"})
        @DisplayName("Mixed case and keyword-like words are identifiers")
        void testIdentifiers(String word) {
            Token token = new Lexer(word).next();

            assertThat(token.type()).isEqualTo(TokenType.IDENTIFIER);
            assertThat(token.text()).isEqualTo(word);
        }

        @ParameterizedTest
        @ValueSource(strings = {"where", "GROUP", "by", "order", "limit", "distinct", "join", "on", "having", "as"})
        @DisplayName("Clause words that no statement uses are identifiers")
        void testClauseWordsAreIdentifiers(String word) {
            assertThat(new Lexer(word).next()).isEqualTo(new Token(TokenType.IDENTIFIER, word, 0));
        }
    }

    @Nested
    @DisplayName("Literals")
    class LiteralTests {

        @ParameterizedTest
        @ValueSource(strings = {"0", "42", "-7", "+13", "007"})
        @DisplayName("Integers, optionally signed, become a single INTEGER token")
        void testIntegers(String text) {
            Token token = new Lexer(text).next();

            assertThat(token.type()).isEqualTo(TokenType.INTEGER);
            assertThat(token.text()).isEqualTo(text);
        }

        @Test
        @DisplayName("A word starting with digits is an identifier")
        void testDigitLedWord() {
            assertThat(new Lexer("1abc").next())
                .isEqualTo(new Token(TokenType.IDENTIFIER, "1abc", 0));
        }

        @Test
        @DisplayName("Quoted string yields its unquoted content")
        void testString() {
            List<Token> tokens = tokenize("x 'hello world'");

            assertThat(tokens.get(2)).isEqualTo(new Token(TokenType.STRING, "hello world", 2));
            assertThat(tokens.get(3)).isEqualTo(new Token(TokenType.EOF, "", 15));
        }

        @Test
        @DisplayName("Empty quoted string is allowed")
        void testEmptyString() {
            assertThat(new Lexer("''").next()).isEqualTo(new Token(TokenType.STRING, "", 0));
        }
    }

    @Nested
    @DisplayName("Whitespace and Punctuation")
    class WhitespaceTests {

        @Test
        @DisplayName("A run of mixed blanks is one WHITESPACE token")
        void testWhitespaceRun() {
            List<Token> tokens = tokenize("a \t\r\n b");

            assertThat(tokens).hasSize(4);
            assertThat(tokens.get(1)).isEqualTo(new Token(TokenType.WHITESPACE, " \t\r\n ", 1));
        }

        @Test
        @DisplayName("Punctuation characters map to their own tokens")
        void testPunctuation() {
            assertThat(types(",();.")).containsExactly(
                TokenType.COMMA, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN,
                TokenType.SEMICOLON, TokenType.DOT, TokenType.EOF);
        }

        @Test
        @DisplayName("EOF is returned repeatedly once input is exhausted")
        void testRepeatedEof() {
            Lexer lexer = new Lexer("a");
            lexer.next();

            assertThat(lexer.next().type()).isEqualTo(TokenType.EOF);
            assertThat(lexer.next().type()).isEqualTo(TokenType.EOF);
            assertThat(new Lexer("").next()).isEqualTo(new Token(TokenType.EOF, "", 0));
        }
    }

    @Nested
    @DisplayName("Lexing Errors")
    class ErrorTests {

        @Test
        @DisplayName("Unknown character reports position and remainder")
        void testUnknownCharacter() {
            Lexer lexer = new Lexer("a * b");
            lexer.next();
            lexer.next();

            LexException e = catchThrowableOfType(lexer::next, LexException.class);

            assertThat(e).hasMessageContaining("Unexpected character '*'");
            assertThat(e.getPosition()).isEqualTo(2);
            assertThat(e.getRemainingInput()).isEqualTo("* b");
        }

        @Test
        @DisplayName("Unterminated string is rejected")
        void testUnterminatedString() {
            assertThatThrownBy(() -> new Lexer("'abc").next())
                .isInstanceOf(LexException.class)
                .hasMessageContaining("Unterminated string literal at position 0");
        }

        @ParameterizedTest
        @ValueSource(strings = {"-", "+", "-x", "-1a", "- 1"})
        @DisplayName("Sign without trailing digits is rejected")
        void testDanglingSign(String input) {
            assertThatThrownBy(() -> new Lexer(input).next())
                .isInstanceOf(LexException.class)
                .hasMessageContaining("Sign must be followed by digits");
        }
    }
}

package org.quarterlang.compiler.frontend.lexer;

import org.quarterlang.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 */
public class LexerTest {

    private List<Token> scan(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics, "test.q").scanTokens();
    }

    @Test
    @Tag("unit")
    void tokenizesDeclarationWithComment() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("val x : int = 42 # the answer", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VAL, TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER,
                TokenType.EQUALS, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).text()).isEqualTo("x");
        assertThat(tokens.get(5).value()).isEqualTo(42L);
    }

    @Test
    @Tag("unit")
    void recognizesKeywordsAndPunctuation() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("fn f(a, b) { loop k in 0 to 3 { when a is b { return a * b } } }; x = y / 2 - 1", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).contains(
                TokenType.FN, TokenType.LEFT_PAREN, TokenType.COMMA, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACE,
                TokenType.LOOP, TokenType.IN, TokenType.TO, TokenType.WHEN, TokenType.IS, TokenType.RETURN,
                TokenType.STAR, TokenType.RIGHT_BRACE, TokenType.SEMICOLON, TokenType.SLASH, TokenType.MINUS);
    }

    @Test
    @Tag("unit")
    void tracksLinesAndEmitsNewlineTokens() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("val a : int = 1\nprint(a)", diagnostics);

        Token newline = tokens.get(6);
        assertThat(newline.type()).isEqualTo(TokenType.NEWLINE);
        Token print = tokens.get(7);
        assertThat(print.text()).isEqualTo("print");
        assertThat(print.line()).isEqualTo(2);
        assertThat(print.column()).isEqualTo(1);
        assertThat(print.fileName()).isEqualTo("test.q");
    }

    @Test
    @Tag("unit")
    void identifiersMayContainDigitsAndUnderscores() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("_tmp1 i_2 value", diagnostics);

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(tokens).extracting(Token::text).startsWith("_tmp1", "i_2", "value");
    }

    @Test
    @Tag("unit")
    void reportsUnexpectedCharacter() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        scan("val x : int = 1 @", diagnostics);

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).isEqualTo("[ERROR] test.q:1: Unexpected character: @");
    }

    @Test
    @Tag("unit")
    void reportsMalformedAndOversizedNumbers() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        scan("12ab\n99999999999999999999", diagnostics);

        assertThat(diagnostics.getDiagnostics()).hasSize(2);
        assertThat(diagnostics.summary())
                .contains("Invalid number format: 12ab")
                .contains("test.q:2: Integer literal out of range: 99999999999999999999");
    }
}

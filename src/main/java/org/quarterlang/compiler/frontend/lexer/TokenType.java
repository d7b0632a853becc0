package org.quarterlang.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON, EQUALS, SEMICOLON,
    PLUS, MINUS, STAR, SLASH,

    // Literals.
    /** An identifier, such as a value or function name. */
    IDENTIFIER,
    /** A decimal integer literal. */
    NUMBER,

    // Keywords.
    VAL, FN, LOOP, IN, TO, WHEN, IS, RETURN,

    // Miscellaneous.
    /** A newline character; statements are newline or semicolon separated. */
    NEWLINE,
    /** Represents the end of the source. */
    END_OF_FILE
}

package io.github.cyfko.texml.core.model;

/**
 * Lexical categories produced by the lexer.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {
    /** {@code \name} or a single escaped character such as {@code \{}. */
    COMMAND,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    VERT,
    SUBSCRIPT,
    SUPERSCRIPT,
    AMPERSAND,
    /** {@code \\} */
    LINE_BREAK,
    IDENTIFIER,
    NUMBER,
    OPERATOR,
    EOF;

    /**
     * @return true for the tokens that close a group or a delimited run
     */
    public boolean isCloser() {
        return this == RIGHT_BRACE || this == RIGHT_PAREN || this == RIGHT_BRACKET;
    }
}

package io.github.cyfko.texml.core.model;

import java.util.Objects;

/**
 * Immutable lexical token.
 *
 * @param kind     lexical category
 * @param value    token text; the name without backslash for commands
 * @param position char offset of the token in the source
 * @param length   number of source chars covered by the token
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String value, int position, int length) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative, got: " + length);
        }
    }

    public static Token eof(int position) {
        return new Token(TokenKind.EOF, "", position, 0);
    }

    /**
     * @return offset of the first source char after this token
     */
    public int end() {
        return position + length;
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /**
     * @param name command name without backslash
     * @return true if this token is the command {@code \name}
     */
    public boolean isCommand(String name) {
        return kind == TokenKind.COMMAND && value.equals(name);
    }

    public boolean isOperator(String symbol) {
        return kind == TokenKind.OPERATOR && value.equals(symbol);
    }

    /**
     * Renders the token the way it would appear in LaTeX source.
     */
    public String toSource() {
        return switch (kind) {
            case COMMAND -> "\\" + value;
            case EOF -> "end of input";
            default -> value;
        };
    }
}

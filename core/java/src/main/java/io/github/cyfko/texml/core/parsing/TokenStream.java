package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.exception.ErrorKind;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.model.TokenKind;

import java.util.List;
import java.util.Objects;

/**
 * Cursor over an immutable token list.
 * <p>
 * Reading past the end keeps returning an EOF token, so callers never have to bound-check.
 * The only non-trivial operation is {@link #advanceLeadingDigit()}, which lets a multi-digit
 * number act as several one-digit arguments ({@code x^23} means {@code x^{2}3}) without
 * editing the list: the remainder of the number is held in an overlay slot.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TokenStream {

    private final List<Token> tokens;
    private final Token endOfInput;
    private int index;
    private Token overlay;

    /**
     * @param tokens tokens as produced by the {@link Lexer}; a trailing EOF token is optional
     */
    public TokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        Token last = this.tokens.isEmpty() ? null : this.tokens.get(this.tokens.size() - 1);
        if (last != null && last.is(TokenKind.EOF)) {
            this.endOfInput = last;
        } else {
            this.endOfInput = Token.eof(last == null ? 0 : last.end());
        }
    }

    /**
     * @return the current token, EOF past the end
     */
    public Token peek() {
        if (overlay != null) {
            return overlay;
        }
        return index < tokens.size() ? tokens.get(index) : endOfInput;
    }

    /**
     * @param offset 0 for the current token, 1 for the next one, ...
     * @return the token at that offset, EOF past the end
     */
    public Token peek(int offset) {
        if (offset == 0) {
            return peek();
        }
        // the overlay stands in for tokens[index], so later offsets are unaffected
        int target = index + offset;
        return target < tokens.size() ? tokens.get(target) : endOfInput;
    }

    /**
     * Consumes and returns the current token. At the end, returns EOF without moving.
     */
    public Token advance() {
        Token current = peek();
        if (overlay != null) {
            overlay = null;
            index++;
        } else if (index < tokens.size()) {
            index++;
        }
        return current;
    }

    /**
     * Consumes only the first digit of the current number token.
     * <p>
     * If the current token is a number of several chars, a one-digit number token is returned
     * and the rest of the number stays current. Any other token is simply consumed.
     * </p>
     *
     * @return the consumed (possibly one-digit) token
     */
    public Token advanceLeadingDigit() {
        Token current = peek();
        if (current.is(TokenKind.NUMBER) && current.value().length() > 1) {
            Token digit = new Token(TokenKind.NUMBER, current.value().substring(0, 1), current.position(),
                    Math.min(1, current.length()));
            overlay = new Token(TokenKind.NUMBER, current.value().substring(1), current.position() + 1,
                    Math.max(0, current.length() - 1));
            return digit;
        }
        return advance();
    }

    public boolean isAtEnd() {
        return peek().is(TokenKind.EOF);
    }

    public boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    public boolean checkCommand(String name) {
        return peek().isCommand(name);
    }

    /**
     * Consumes the current token if it has the given kind.
     *
     * @return true if a token was consumed
     */
    public boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes the current token, which must have the given kind.
     *
     * @param kind expected kind
     * @return the consumed token
     * @throws CompileException {@code UnexpectedEof} at the end of input,
     *                          {@code UnexpectedToken} on any other kind
     */
    public Token expect(TokenKind kind) {
        Token current = peek();
        if (current.is(kind)) {
            return advance();
        }
        if (current.is(TokenKind.EOF)) {
            throw CompileException.unexpectedEof(current.position());
        }
        throw new CompileException(ErrorKind.UNEXPECTED_TOKEN,
                "Expected " + kind + ", got " + current.kind(), current.position());
    }

    /**
     * @return source position of the current token
     */
    public int position() {
        return peek().position();
    }

    /**
     * @return an opaque mark for {@link #reset(int)}
     */
    public int mark() {
        if (overlay != null) {
            throw new IllegalStateException("Cannot mark inside a split number");
        }
        return index;
    }

    public void reset(int mark) {
        if (mark < 0 || mark > tokens.size()) {
            throw new IllegalArgumentException("Invalid mark: " + mark);
        }
        overlay = null;
        index = mark;
    }
}

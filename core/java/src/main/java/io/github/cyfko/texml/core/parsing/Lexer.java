package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.exception.ErrorKind;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.model.TokenKind;
import io.github.cyfko.texml.core.spi.DefaultUnicodeSymbolTable;
import io.github.cyfko.texml.core.spi.UnicodeMapping;
import io.github.cyfko.texml.core.spi.UnicodeSymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts LaTeX source into a flat list of {@link Token}s.
 * <p>
 * Whitespace and {@code %} comments are dropped; token positions let later stages recover
 * the original spacing where it matters (text mode). Letters are never merged: {@code ab}
 * lexes as two identifiers. The list always ends with exactly one {@link TokenKind#EOF} token.
 * </p>
 *
 * <pre>{@code
 * List<Token> tokens = Lexer.standard().lex("\\frac{a}{2.5}");
 * // COMMAND(frac) LEFT_BRACE IDENTIFIER(a) RIGHT_BRACE LEFT_BRACE NUMBER(2.5) RIGHT_BRACE EOF
 * }</pre>
 *
 * <p>Non-ASCII characters are resolved through a {@link UnicodeSymbolTable}. Unmapped letters
 * become identifiers; any other unmapped character fails with an
 * {@link ErrorKind#UNEXPECTED_TOKEN} error.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer {

    private static final String OPERATOR_CHARACTERS = "+-*/=<>.,;:!?'~#";

    private static final Lexer STANDARD = new Lexer(DefaultUnicodeSymbolTable.getInstance());

    private final UnicodeSymbolTable unicodeTable;

    public Lexer(UnicodeSymbolTable unicodeTable) {
        this.unicodeTable = Objects.requireNonNull(unicodeTable, "unicodeTable");
    }

    /**
     * @return a lexer using the {@link DefaultUnicodeSymbolTable}
     */
    public static Lexer standard() {
        return STANDARD;
    }

    /**
     * Tokenizes the whole source.
     *
     * @param source LaTeX math source
     * @return the tokens, terminated by an EOF token
     * @throws CompileException on a character no rule accepts
     */
    public List<Token> lex(String source) {
        Objects.requireNonNull(source, "source");
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = source.length();

        while (pos < length) {
            char c = source.charAt(pos);

            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                pos++;
            } else if (c == '%') {
                while (pos < length && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == '\\') {
                pos = lexCommand(source, pos, tokens);
            } else if (isAsciiDigit(c)) {
                pos = lexNumber(source, pos, tokens);
            } else if (isAsciiLetter(c)) {
                tokens.add(new Token(TokenKind.IDENTIFIER, String.valueOf(c), pos, 1));
                pos++;
            } else if (c < 0x80) {
                tokens.add(lexPunctuation(c, pos));
                pos++;
            } else {
                pos = lexUnicode(source, pos, tokens);
            }
        }

        tokens.add(Token.eof(length));
        return tokens;
    }

    private int lexCommand(String source, int start, List<Token> tokens) {
        int pos = start + 1;
        if (pos >= source.length()) {
            throw new CompileException(ErrorKind.UNEXPECTED_EOF,
                    "Unexpected end of input after \\", start);
        }
        char next = source.charAt(pos);
        if (next == '\\') {
            tokens.add(new Token(TokenKind.LINE_BREAK, "\\\\", start, 2));
            return pos + 1;
        }
        if (!isAsciiLetter(next)) {
            // single-character command: \{ \, \! \  ...
            int codePoint = source.codePointAt(pos);
            int width = Character.charCount(codePoint);
            tokens.add(new Token(TokenKind.COMMAND, source.substring(pos, pos + width), start, 1 + width));
            return pos + width;
        }
        int end = pos;
        while (end < source.length() && isAsciiLetter(source.charAt(end))) {
            end++;
        }
        tokens.add(new Token(TokenKind.COMMAND, source.substring(pos, end), start, end - start));
        return end;
    }

    private static int lexNumber(String source, int start, List<Token> tokens) {
        int pos = skipDigits(source, start);
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && isAsciiDigit(source.charAt(pos + 1))) {
            pos = skipDigits(source, pos + 1);
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < source.length() && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < source.length() && isAsciiDigit(source.charAt(exponent))) {
                pos = skipDigits(source, exponent);
            }
        }
        tokens.add(new Token(TokenKind.NUMBER, source.substring(start, pos), start, pos - start));
        return pos;
    }

    private static Token lexPunctuation(char c, int pos) {
        TokenKind kind = switch (c) {
            case '{' -> TokenKind.LEFT_BRACE;
            case '}' -> TokenKind.RIGHT_BRACE;
            case '(' -> TokenKind.LEFT_PAREN;
            case ')' -> TokenKind.RIGHT_PAREN;
            case '[' -> TokenKind.LEFT_BRACKET;
            case ']' -> TokenKind.RIGHT_BRACKET;
            case '|' -> TokenKind.VERT;
            case '_' -> TokenKind.SUBSCRIPT;
            case '^' -> TokenKind.SUPERSCRIPT;
            case '&' -> TokenKind.AMPERSAND;
            default -> OPERATOR_CHARACTERS.indexOf(c) >= 0 ? TokenKind.OPERATOR : null;
        };
        if (kind == null) {
            throw CompileException.unexpectedCharacter(String.valueOf(c), pos);
        }
        return new Token(kind, String.valueOf(c), pos, 1);
    }

    private int lexUnicode(String source, int pos, List<Token> tokens) {
        int codePoint = source.codePointAt(pos);
        int width = Character.charCount(codePoint);
        String text = source.substring(pos, pos + width);
        Optional<UnicodeMapping> mapping = unicodeTable.lookup(codePoint);

        if (mapping.isEmpty()) {
            if (!Character.isLetter(codePoint)) {
                throw CompileException.unexpectedCharacter(text, pos);
            }
            tokens.add(new Token(TokenKind.IDENTIFIER, text, pos, width));
            return pos + width;
        }

        UnicodeMapping resolved = mapping.get();
        UnicodeMapping.Category category = resolved.category();
        if (category.isCommand()) {
            tokens.add(new Token(TokenKind.COMMAND, resolved.latex(), pos, width));
        } else if (category.isScript()) {
            boolean superscript = category == UnicodeMapping.Category.SUPERSCRIPT;
            String latex = resolved.latex();
            TokenKind contentKind = isAsciiDigit(latex.charAt(0)) ? TokenKind.NUMBER : TokenKind.IDENTIFIER;
            tokens.add(new Token(superscript ? TokenKind.SUPERSCRIPT : TokenKind.SUBSCRIPT,
                    superscript ? "^" : "_", pos, width));
            tokens.add(new Token(TokenKind.LEFT_BRACE, "{", pos, 0));
            tokens.add(new Token(contentKind, latex, pos, 0));
            tokens.add(new Token(TokenKind.RIGHT_BRACE, "}", pos, 0));
        } else {
            tokens.add(new Token(TokenKind.OPERATOR, resolved.latex(), pos, width));
        }
        return pos + width;
    }

    private static int skipDigits(String source, int pos) {
        while (pos < source.length() && isAsciiDigit(source.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}

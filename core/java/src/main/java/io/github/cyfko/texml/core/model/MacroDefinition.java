package io.github.cyfko.texml.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A user-defined command registered by {@code \def} or {@code \newcommand}.
 * <p>
 * The body is kept as raw tokens. Parameters appear in the body as an operator token
 * {@code #} followed by a number token.
 * </p>
 *
 * @param name  command name without backslash
 * @param arity number of arguments, 0 to 9
 * @param body  body tokens, without the surrounding braces
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MacroDefinition(String name, int arity, List<Token> body) {

    public static final int MAX_ARITY = 9;

    public MacroDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Macro name is required");
        }
        if (arity < 0 || arity > MAX_ARITY) {
            throw new IllegalArgumentException("arity must be between 0 and " + MAX_ARITY + ", got: " + arity);
        }
        body = List.copyOf(Objects.requireNonNull(body, "body"));
    }

    /**
     * Substitutes the arguments into a fresh copy of the body.
     * <p>
     * Each {@code #k} with {@code 1 <= k <= arity} is replaced by the tokens of argument
     * {@code k}. Only the first digit of the number token names the parameter: the remaining
     * digits are kept as a number token. Any other {@code #} is copied unchanged.
     * </p>
     *
     * @param arguments exactly {@code arity} argument token lists
     * @return the expanded tokens
     * @throws IllegalArgumentException if the argument count does not match the arity
     */
    public List<Token> expand(List<List<Token>> arguments) {
        if (arguments.size() != arity) {
            throw new IllegalArgumentException(
                    "Macro \\" + name + " expects " + arity + " argument(s), got " + arguments.size());
        }
        List<Token> out = new ArrayList<>(body.size());
        for (int i = 0; i < body.size(); i++) {
            Token token = body.get(i);
            if (token.isOperator("#") && i + 1 < body.size() && body.get(i + 1).is(TokenKind.NUMBER)) {
                Token number = body.get(i + 1);
                int index = number.value().charAt(0) - '0';
                if (index >= 1 && index <= arity) {
                    out.addAll(arguments.get(index - 1));
                    if (number.value().length() > 1) {
                        out.add(new Token(TokenKind.NUMBER, number.value().substring(1),
                                number.position() + 1, number.length() - 1));
                    }
                    i++;
                    continue;
                }
            }
            out.add(token);
        }
        return out;
    }
}

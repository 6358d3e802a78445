package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Fraction, from {@code \frac} or infix {@code \over}.
 */
public record FractionNode(AstNode numerator, AstNode denominator, FractionStyle style) implements AstNode {

    public FractionNode {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        Objects.requireNonNull(style, "style");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFraction(this);
    }
}

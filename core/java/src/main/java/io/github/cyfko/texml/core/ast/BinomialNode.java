package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Binomial coefficient, from {@code \binom} or infix {@code \choose}.
 */
public record BinomialNode(AstNode top, AstNode bottom, FractionStyle style) implements AstNode {

    public BinomialNode {
        Objects.requireNonNull(top, "top");
        Objects.requireNonNull(bottom, "bottom");
        Objects.requireNonNull(style, "style");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinomial(this);
    }
}

package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Square root.
 */
public record SqrtNode(AstNode radicand) implements AstNode {

    public SqrtNode {
        Objects.requireNonNull(radicand, "radicand");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSqrt(this);
    }
}

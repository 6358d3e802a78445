package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Base with content stacked below and/or above it (<code>&#92;underset</code>, {@code \overset},
 * {@code \stackrel}). At least one of {@code under} and {@code over} is present.
 */
public record UnderOverNode(AstNode base, AstNode under, AstNode over) implements AstNode {

    public UnderOverNode {
        Objects.requireNonNull(base, "base");
        if (under == null && over == null) {
            throw new IllegalArgumentException("under or over is required");
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnderOver(this);
    }
}

package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Numeric literal, kept as written.
 */
public record NumberNode(String value) implements AstNode {

    public NumberNode {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}

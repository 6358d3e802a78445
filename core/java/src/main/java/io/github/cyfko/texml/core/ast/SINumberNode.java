package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Raw {@code \num} argument; formatting happens in the generator.
 */
public record SINumberNode(String value) implements AstNode {

    public SINumberNode {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSINumber(this);
    }
}

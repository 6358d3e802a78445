package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Named function such as {@code \sin}, rendered upright.
 */
public record FunctionNode(String name) implements AstNode {

    public FunctionNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}

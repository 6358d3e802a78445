package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Base with a subscript.
 */
public record SubscriptNode(AstNode base, AstNode subscript) implements AstNode {

    public SubscriptNode {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(subscript, "subscript");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }
}

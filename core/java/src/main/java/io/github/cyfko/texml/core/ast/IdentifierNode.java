package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Variable name: a single letter, or the name of an unknown command.
 */
public record IdentifierNode(String name) implements AstNode {

    public IdentifierNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}

package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Explicit horizontal space; {@code width} is a CSS length such as {@code 1em}.
 */
public record SpaceNode(String width) implements AstNode {

    public SpaceNode {
        Objects.requireNonNull(width, "width");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSpace(this);
    }
}

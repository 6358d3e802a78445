package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Coloured content.
 */
public record ColorNode(String color, AstNode content) implements AstNode {

    public ColorNode {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(content, "content");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitColor(this);
    }
}

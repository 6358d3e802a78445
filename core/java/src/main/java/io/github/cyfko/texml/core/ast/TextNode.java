package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Upright text from {@code \text} and friends.
 */
public record TextNode(String text) implements AstNode {

    public TextNode {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}

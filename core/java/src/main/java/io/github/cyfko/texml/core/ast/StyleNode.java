package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Font variant switch such as {@code \mathbb}.
 */
public record StyleNode(StyleKind style, AstNode content) implements AstNode {

    public StyleNode {
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(content, "content");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStyle(this);
    }
}

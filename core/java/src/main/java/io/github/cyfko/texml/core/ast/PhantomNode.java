package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Invisible content that still takes up space.
 */
public record PhantomNode(PhantomKind kind, AstNode content) implements AstNode {

    public PhantomNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPhantom(this);
    }
}

package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Root with an explicit index, {@code \sqrt[n]{x}}.
 */
public record RootNode(AstNode radicand, AstNode index) implements AstNode {

    public RootNode {
        Objects.requireNonNull(radicand, "radicand");
        Objects.requireNonNull(index, "index");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRoot(this);
    }
}

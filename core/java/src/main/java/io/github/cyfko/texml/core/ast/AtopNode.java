package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Stacked pair without a rule, from infix {@code \atop}.
 */
public record AtopNode(AstNode top, AstNode bottom) implements AstNode {

    public AtopNode {
        Objects.requireNonNull(top, "top");
        Objects.requireNonNull(bottom, "bottom");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAtop(this);
    }
}

package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * {@code \displaystyle} and friends, applied to the rest of the enclosing group.
 */
public record MathStyleNode(MathStyleLevel level, AstNode content) implements AstNode {

    public MathStyleNode {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(content, "content");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMathStyle(this);
    }
}

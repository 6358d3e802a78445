package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Size switch such as {@code \large}, applied to the rest of the enclosing group.
 */
public record MathSizeNode(MathSizeKind size, AstNode content) implements AstNode {

    public MathSizeNode {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(content, "content");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMathSize(this);
    }
}

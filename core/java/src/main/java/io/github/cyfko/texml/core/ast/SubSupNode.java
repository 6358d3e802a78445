package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Base carrying both scripts; {@code x_i^2} and {@code x^2_i} both produce this node.
 */
public record SubSupNode(AstNode base, AstNode subscript, AstNode superscript) implements AstNode {

    public SubSupNode {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(subscript, "subscript");
        Objects.requireNonNull(superscript, "superscript");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSubSup(this);
    }
}

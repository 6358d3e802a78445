package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Base with a superscript.
 */
public record SuperscriptNode(AstNode base, AstNode superscript) implements AstNode {

    public SuperscriptNode {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(superscript, "superscript");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSuperscript(this);
    }
}

package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Accent or over/under decoration applied to {@code base}.
 */
public record AccentNode(AccentKind accent, AstNode base) implements AstNode {

    public AccentNode {
        Objects.requireNonNull(accent, "accent");
        Objects.requireNonNull(base, "base");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAccent(this);
    }
}

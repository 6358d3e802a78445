package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Delimiter with an explicit size, from {@code \big} ({@code size} 1) up to {@code \Bigg} (4).
 */
public record SizedDelimiterNode(String delimiter, int size, OperatorForm form) implements AstNode {

    public SizedDelimiterNode {
        Objects.requireNonNull(delimiter, "delimiter");
        Objects.requireNonNull(form, "form");
        if (size < 1 || size > 4) {
            throw new IllegalArgumentException("size must be between 1 and 4, got: " + size);
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSizedDelimiter(this);
    }
}

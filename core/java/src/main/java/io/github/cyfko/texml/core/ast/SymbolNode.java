package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Named letter-like symbol such as {@code \alpha} or {@code \infty}; {@code value} is the Unicode text.
 */
public record SymbolNode(String name, String value) implements AstNode {

    public SymbolNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }
}

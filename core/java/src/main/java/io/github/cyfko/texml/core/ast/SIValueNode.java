package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Quantity from {@code \SI{value}{unit}}; {@code value} is raw like {@link SINumberNode}.
 */
public record SIValueNode(String value, SIUnitNode unit) implements AstNode {

    public SIValueNode {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unit, "unit");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSIValue(this);
    }
}

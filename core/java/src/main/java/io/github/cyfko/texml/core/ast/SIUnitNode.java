package io.github.cyfko.texml.core.ast;

import io.github.cyfko.texml.core.model.SIUnitComponent;

import java.util.List;
import java.util.Objects;

/**
 * Unit expression from {@code \si}. Both lists hold positive powers; terms written with a
 * negative power or after {@code \per} live in {@code denominator}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SIUnitNode(List<SIUnitComponent> numerator, List<SIUnitComponent> denominator) implements AstNode {

    public SIUnitNode {
        numerator = List.copyOf(Objects.requireNonNull(numerator, "numerator"));
        denominator = List.copyOf(Objects.requireNonNull(denominator, "denominator"));
    }

    public boolean isEmpty() {
        return numerator.isEmpty() && denominator.isEmpty();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSIUnit(this);
    }
}

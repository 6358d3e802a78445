package io.github.cyfko.texml.core.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Large operator with optional limits: sums, integrals and limit-like operators such as
 * {@code \lim}.
 *
 * @param name          command name
 * @param symbol        rendered text, e.g. {@code ∑} or {@code lim}
 * @param operatorClass drives the default placement of the limits
 * @param limits        explicit {@code \limits}/{@code \nolimits} choice
 * @param lower         lower limit, or {@code null}
 * @param upper         upper limit, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BigOperatorNode(String name, String symbol, BigOperatorClass operatorClass, LimitsMode limits,
                              AstNode lower, AstNode upper) implements AstNode {

    public BigOperatorNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(operatorClass, "operatorClass");
        Objects.requireNonNull(limits, "limits");
    }

    public Optional<AstNode> lowerLimit() {
        return Optional.ofNullable(lower);
    }

    public Optional<AstNode> upperLimit() {
        return Optional.ofNullable(upper);
    }

    public boolean hasLimits() {
        return lower != null || upper != null;
    }

    /**
     * @return true when the limits go below and above the operator rather than to its side
     */
    public boolean limitsUnderOver() {
        return switch (limits) {
            case LIMITS -> true;
            case NO_LIMITS -> false;
            case AUTO -> operatorClass != BigOperatorClass.INTEGRAL;
        };
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBigOperator(this);
    }
}

package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Operator, relation, punctuation or fence character.
 *
 * @param name  command name or source character the operator was written as
 * @param value Unicode text to render
 * @param form  prefix/infix/postfix role
 * @param fence delimiter behaviour
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OperatorNode(String name, String value, OperatorForm form, FenceStyle fence) implements AstNode {

    public OperatorNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(fence, "fence");
    }

    public static OperatorNode of(String name, String value) {
        return new OperatorNode(name, value, OperatorForm.INFIX, FenceStyle.NONE);
    }

    public static OperatorNode postfix(String name, String value) {
        return new OperatorNode(name, value, OperatorForm.POSTFIX, FenceStyle.NONE);
    }

    public static OperatorNode fence(String name, String value, OperatorForm form, FenceStyle fence) {
        return new OperatorNode(name, value, form, fence);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitOperator(this);
    }
}

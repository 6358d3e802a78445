package io.github.cyfko.texml.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Horizontal sequence of nodes. A row without children is an explicit empty slot, used as
 * the base of leading scripts and for empty matrix cells.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RowNode(List<AstNode> children) implements AstNode {

    public RowNode {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    public static RowNode empty() {
        return new RowNode(List.of());
    }

    public static RowNode of(AstNode... children) {
        return new RowNode(List.of(children));
    }

    /**
     * Wraps a parsed sequence: no node gives an empty row, one node is returned as is,
     * more nodes are wrapped in a row.
     *
     * @param nodes the sequence
     * @return the wrapped node
     */
    public static AstNode wrap(List<AstNode> nodes) {
        return nodes.size() == 1 ? nodes.get(0) : new RowNode(nodes);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRow(this);
    }
}

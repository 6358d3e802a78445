package io.github.cyfko.texml.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Tabular environment: matrices, {@code cases} and the alignment environments.
 *
 * @param environment which environment produced the table
 * @param rows        cells row by row; rows may have different lengths
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MatrixNode(EnvironmentKind environment, List<List<AstNode>> rows) implements AstNode {

    public MatrixNode {
        Objects.requireNonNull(environment, "environment");
        rows = Objects.requireNonNull(rows, "rows").stream().map(List::copyOf).toList();
    }

    /**
     * @return the number of cells of the widest row
     */
    public int columnCount() {
        return rows.stream().mapToInt(List::size).max().orElse(0);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMatrix(this);
    }
}

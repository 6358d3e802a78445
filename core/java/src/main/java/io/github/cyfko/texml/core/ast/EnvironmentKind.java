package io.github.cyfko.texml.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Environments accepted by {@code \begin}, with the fences drawn around the table.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum EnvironmentKind {
    MATRIX("matrix", "", "", Family.MATRIX),
    PMATRIX("pmatrix", "(", ")", Family.MATRIX),
    BMATRIX("bmatrix", "[", "]", Family.MATRIX),
    BRACE_MATRIX("Bmatrix", "{", "}", Family.MATRIX),
    VMATRIX("vmatrix", "|", "|", Family.MATRIX),
    DOUBLE_VMATRIX("Vmatrix", "‖", "‖", Family.MATRIX),
    CASES("cases", "{", "", Family.CASES),
    ALIGN("align", "", "", Family.ALIGNMENT),
    ALIGN_STAR("align*", "", "", Family.ALIGNMENT),
    ALIGNED("aligned", "", "", Family.ALIGNMENT),
    GATHER("gather", "", "", Family.GATHER),
    GATHER_STAR("gather*", "", "", Family.GATHER),
    GATHERED("gathered", "", "", Family.GATHER);

    /**
     * Layout families sharing cell parsing and column alignment rules.
     */
    public enum Family {
        MATRIX,
        CASES,
        /** Alternating right/left columns. */
        ALIGNMENT,
        /** Centered columns. */
        GATHER
    }

    private final String environmentName;
    private final String open;
    private final String close;
    private final Family family;

    EnvironmentKind(String environmentName, String open, String close, Family family) {
        this.environmentName = environmentName;
        this.open = open;
        this.close = close;
        this.family = family;
    }

    public String environmentName() {
        return environmentName;
    }

    /**
     * @return left fence, empty when none
     */
    public String open() {
        return open;
    }

    /**
     * @return right fence, empty when none
     */
    public String close() {
        return close;
    }

    public Family family() {
        return family;
    }

    /**
     * @return true when each cell is a full expression rather than a run of terms
     */
    public boolean hasExpressionCells() {
        return family == Family.ALIGNMENT || family == Family.GATHER;
    }

    public static Optional<EnvironmentKind> fromName(String name) {
        return Arrays.stream(values()).filter(kind -> kind.environmentName.equals(name)).findFirst();
    }
}

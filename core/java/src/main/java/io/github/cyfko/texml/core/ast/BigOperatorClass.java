package io.github.cyfko.texml.core.ast;

/**
 * Families of large operators.
 */
public enum BigOperatorClass {
    /** Sums, products, big unions: limits below and above. */
    SUMMATION,
    /** Integrals: limits on the side. */
    INTEGRAL,
    /** Word operators such as {@code lim} or {@code max}. */
    LIMIT
}

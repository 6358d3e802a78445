package io.github.cyfko.texml.core.ast;

/**
 * Display-style override of a fraction or binomial.
 */
public enum FractionStyle {
    /** Inherit the surrounding style. */
    NORMAL,
    /** {@code \dfrac}, {@code \cfrac}, {@code \dbinom}. */
    DISPLAY,
    /** {@code \tfrac}, {@code \tbinom}. */
    TEXT
}

package io.github.cyfko.texml.core.ast;

/**
 * How an operator behaves as a delimiter.
 */
public enum FenceStyle {
    /** Ordinary operator. */
    NONE,
    /** Bracket that keeps its natural size: parentheses typed directly, {@code \langle}. */
    FIXED,
    /** Bracket that grows with its content: {@code \left}, {@code \middle}, matrix fences. */
    STRETCHY
}

package io.github.cyfko.texml.core.ast;

/**
 * Which dimensions of a phantom are kept.
 */
public enum PhantomKind {
    /** Width, height and depth. */
    FULL,
    /** Width only. */
    HORIZONTAL,
    /** Height and depth only. */
    VERTICAL
}

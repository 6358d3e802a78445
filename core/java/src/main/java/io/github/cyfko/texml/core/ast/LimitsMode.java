package io.github.cyfko.texml.core.ast;

/**
 * Limit placement requested by {@code \limits} or {@code \nolimits}.
 */
public enum LimitsMode {
    AUTO,
    LIMITS,
    NO_LIMITS
}

package io.github.cyfko.texml.core.parsing;

/**
 * Semantic category of a built-in command. The parser keeps one handler per category.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum CommandCategory {
    FRACTION,
    BINOMIAL,
    GENERALIZED_FRACTION,
    /** {@code \over}, {@code \choose}, {@code \atop}: handled by the sequence loop. */
    INFIX_FRACTION,
    SQRT,
    GREEK,
    OPERATOR,
    SYMBOL,
    FENCE,
    NEGATION,
    STYLE,
    ACCENT,
    BIG_OPERATOR,
    FUNCTION,
    DELIMITER,
    SIZED_DELIMITER,
    ENVIRONMENT,
    TEXT,
    SPACE,
    COLOR,
    MATH_STYLE,
    MATH_SIZE,
    PHANTOM,
    UNDER_OVER,
    SIUNITX,
    SI_UNIT,
    SI_PREFIX,
    SI_OPERATOR,
    MACRO_DEFINITION,
    /** Commands accepted for compatibility that produce no output. */
    IGNORED
}

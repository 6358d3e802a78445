package io.github.cyfko.texml.core.spi;

import java.util.Objects;

/**
 * LaTeX equivalent of a non-ASCII input character.
 *
 * @param latex    command name (without backslash), operator character or script character,
 *                 depending on {@code category}
 * @param category how the lexer turns the character into tokens
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record UnicodeMapping(String latex, Category category) {

    /**
     * Token shapes a mapped character expands to.
     */
    public enum Category {
        /** One command token, e.g. {@code α → \alpha}. */
        GREEK_LETTER,
        /** One command token, e.g. {@code ∞ → \infty}. */
        SYMBOL,
        /** One command token, e.g. {@code ∑ → \sum}. */
        BIG_OPERATOR,
        /** One command token, e.g. {@code √ → \sqrt}. */
        COMMAND,
        /** One operator token carrying the character itself. */
        OPERATOR,
        /** One operator token carrying the character itself. */
        RELATION,
        /** Four tokens {@code ^ { x }}. */
        SUPERSCRIPT,
        /** Four tokens {@code _ { x }}. */
        SUBSCRIPT;

        /**
         * @return true when the mapping produces a single command token
         */
        public boolean isCommand() {
            return this == GREEK_LETTER || this == SYMBOL || this == BIG_OPERATOR || this == COMMAND;
        }

        public boolean isScript() {
            return this == SUPERSCRIPT || this == SUBSCRIPT;
        }
    }

    public UnicodeMapping {
        if (latex == null || latex.isEmpty()) {
            throw new IllegalArgumentException("latex is required");
        }
        Objects.requireNonNull(category, "category");
    }
}

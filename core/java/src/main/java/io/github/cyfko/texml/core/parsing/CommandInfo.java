package io.github.cyfko.texml.core.parsing;

import java.util.Objects;

/**
 * Table entry for a built-in command.
 *
 * @param category semantic category selecting the handler
 * @param arity    number of mandatory arguments
 */
public record CommandInfo(CommandCategory category, int arity) {

    public CommandInfo {
        Objects.requireNonNull(category, "category");
        if (arity < 0) {
            throw new IllegalArgumentException("arity must not be negative, got: " + arity);
        }
    }
}

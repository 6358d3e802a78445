package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.model.Token;

import java.util.Optional;

/**
 * Parses the arguments of one category of commands. The command token itself has already
 * been consumed when the handler runs.
 */
@FunctionalInterface
interface CommandHandler {

    /**
     * @param command the command token
     * @param info    its table entry
     * @return the node produced, or empty when the command produces no output
     *         (macro definitions, ignored commands)
     */
    Optional<AstNode> handle(Token command, CommandInfo info);
}

package io.github.cyfko.texml.spring.service.impl;

import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.model.MacroDefinition;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.model.TokenKind;
import io.github.cyfko.texml.core.parsing.Lexer;
import io.github.cyfko.texml.core.spi.MacroRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds the preamble registry from the {@code texml.macros} property.
 */
public final class PreambleLoader {
    private static final Logger LOGGER = Logger.getLogger(PreambleLoader.class.getName());

    private PreambleLoader() {
    }

    /**
     * @param macros name (with or without leading backslash) to body
     * @return a registry holding one definition per entry
     * @throws IllegalStateException if a body cannot be tokenized
     */
    public static MacroRegistry load(Map<String, String> macros) {
        MacroRegistry registry = new MacroRegistry();
        if (macros == null) {
            return registry;
        }
        macros.forEach((name, body) -> registry.define(toDefinition(name, body)));
        LOGGER.fine(() -> "Loaded " + registry.size() + " preamble macro(s)");
        return registry;
    }

    static MacroDefinition toDefinition(String name, String body) {
        String command = name.startsWith("\\") ? name.substring(1) : name;
        List<Token> tokens;
        try {
            tokens = new ArrayList<>(Lexer.standard().lex(body == null ? "" : body));
        } catch (CompileException e) {
            throw new IllegalStateException("Invalid body for preamble macro \\" + command + ": " + e.getMessage(), e);
        }
        tokens.removeIf(token -> token.is(TokenKind.EOF));
        return new MacroDefinition(command, arity(tokens), tokens);
    }

    /**
     * Highest parameter number used in the body.
     */
    static int arity(List<Token> body) {
        int arity = 0;
        for (int i = 0; i + 1 < body.size(); i++) {
            if (body.get(i).isOperator("#") && body.get(i + 1).is(TokenKind.NUMBER)) {
                arity = Math.max(arity, body.get(i + 1).value().charAt(0) - '0');
            }
        }
        return arity;
    }
}

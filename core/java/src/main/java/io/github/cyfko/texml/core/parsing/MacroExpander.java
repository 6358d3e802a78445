package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.exception.ErrorKind;
import io.github.cyfko.texml.core.model.MacroDefinition;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.model.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles {@code \def}, {@code \newcommand}, {@code \renewcommand}, {@code \providecommand}
 * and the expansion of the macros they define.
 * <p>
 * Expansion substitutes the arguments into the body and parses the result with a child
 * {@link Parser}. Macros used inside a body are expanded by that child, one level deeper;
 * {@code CompilerPolicy#maxExpansionDepth()} bounds the chain.
 * </p>
 */
final class MacroExpander {

    private final Parser parser;

    MacroExpander(Parser parser) {
        this.parser = parser;
    }

    /**
     * @param command the defining command, already consumed
     */
    void define(Token command) {
        MacroDefinition definition = command.isCommand("def") ? readDef(command) : readNewCommand(command);
        if (command.isCommand("providecommand")) {
            parser.registry().defineIfAbsent(definition);
        } else {
            parser.registry().define(definition);
        }
    }

    /**
     * {@code \def\name#1#2{body}}
     */
    private MacroDefinition readDef(Token command) {
        TokenStream tokens = parser.tokens();
        Token name = tokens.peek();
        if (name.is(TokenKind.EOF)) {
            throw CompileException.missingArgument(command.value(), command.position());
        }
        if (!name.is(TokenKind.COMMAND)) {
            throw CompileException.invalidArgument("Expected a command name after \\def", name.position());
        }
        tokens.advance();

        int arity = 0;
        while (tokens.peek().isOperator("#")) {
            Token hash = tokens.advance();
            Token number = tokens.peek();
            if (!number.is(TokenKind.NUMBER) || !number.value().equals(String.valueOf(arity + 1))) {
                throw CompileException.invalidArgument("Parameters must be numbered #1 to #9 in order", hash.position());
            }
            tokens.advance();
            arity++;
            if (arity > MacroDefinition.MAX_ARITY) {
                throw CompileException.invalidArgument(
                        "A macro takes at most " + MacroDefinition.MAX_ARITY + " arguments", hash.position());
            }
        }
        return new MacroDefinition(name.value(), arity, readBody(command));
    }

    /**
     * {@code \newcommand{\name}[n]{body}}, braces around the name optional.
     */
    private MacroDefinition readNewCommand(Token command) {
        TokenStream tokens = parser.tokens();
        Token next = tokens.peek();
        String name;
        if (next.is(TokenKind.LEFT_BRACE)) {
            Parser.RawArgument argument = parser.readRawArgument(command);
            if (argument.tokens().size() != 1 || !argument.tokens().get(0).is(TokenKind.COMMAND)) {
                throw CompileException.invalidArgument(
                        "Expected a command name after " + command.toSource(), next.position());
            }
            name = argument.tokens().get(0).value();
        } else if (next.is(TokenKind.COMMAND)) {
            name = tokens.advance().value();
        } else if (next.is(TokenKind.EOF)) {
            throw CompileException.missingArgument(command.value(), command.position());
        } else {
            throw CompileException.invalidArgument(
                    "Expected a command name after " + command.toSource(), next.position());
        }

        int arity = 0;
        if (tokens.check(TokenKind.LEFT_BRACKET)) {
            arity = readArity(tokens);
            if (tokens.check(TokenKind.LEFT_BRACKET)) {
                throw CompileException.invalidArgument("Optional macro arguments are not supported", tokens.position());
            }
        }
        return new MacroDefinition(name, arity, readBody(command));
    }

    private static int readArity(TokenStream tokens) {
        Token open = tokens.advance();
        StringBuilder text = new StringBuilder();
        while (!tokens.check(TokenKind.RIGHT_BRACKET)) {
            Token token = tokens.advance();
            if (token.is(TokenKind.EOF)) {
                throw CompileException.unexpectedEof(token.position());
            }
            text.append(token.value());
        }
        tokens.advance();

        int arity;
        try {
            arity = Integer.parseInt(text.toString());
        } catch (NumberFormatException e) {
            throw CompileException.invalidNumber("Invalid argument count: " + text, open.position());
        }
        if (arity < 0 || arity > MacroDefinition.MAX_ARITY) {
            throw CompileException.invalidArgument(
                    "Argument count must be between 0 and " + MacroDefinition.MAX_ARITY + ", got: " + arity,
                    open.position());
        }
        return arity;
    }

    private List<Token> readBody(Token command) {
        if (!parser.tokens().check(TokenKind.LEFT_BRACE)) {
            throw CompileException.missingArgument(command.value(), command.position());
        }
        return parser.readRawArgument(command).tokens();
    }

    /**
     * Expands one use of a macro.
     *
     * @param command    the macro token, already consumed
     * @param definition its definition
     * @return the parsed expansion, empty when the expansion produces nothing
     */
    Optional<AstNode> expand(Token command, MacroDefinition definition) {
        if (parser.expansionDepth() >= parser.policy().maxExpansionDepth()) {
            throw new CompileException(ErrorKind.INVALID_COMMAND,
                    "Macro expansion too deep: " + command.toSource(), command.position());
        }
        TokenStream tokens = parser.tokens();
        List<List<Token>> arguments = new ArrayList<>(definition.arity());
        for (int i = 0; i < definition.arity(); i++) {
            Token next = tokens.peek();
            if (next.is(TokenKind.LEFT_BRACE)) {
                arguments.add(parser.readRawArgument(command).tokens());
            } else if (next.is(TokenKind.EOF) || next.kind().isCloser() || next.is(TokenKind.AMPERSAND)
                    || next.is(TokenKind.LINE_BREAK)) {
                throw CompileException.missingArgument(command.value(), command.position());
            } else {
                arguments.add(List.of(tokens.advanceLeadingDigit()));
            }
        }

        List<Token> expansion = new ArrayList<>(definition.expand(arguments));
        if (expansion.isEmpty()) {
            return Optional.empty();
        }
        expansion.add(Token.eof(command.end()));
        return parser.expansionParser(expansion).parseExpansion();
    }
}

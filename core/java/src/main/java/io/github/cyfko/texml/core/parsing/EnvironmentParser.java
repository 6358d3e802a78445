package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.ast.EnvironmentKind;
import io.github.cyfko.texml.core.ast.MatrixNode;
import io.github.cyfko.texml.core.ast.RowNode;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.model.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code \begin{name} ... \end{name}} into a {@link MatrixNode}.
 * <p>
 * Cells are separated by {@code &} and rows by {@code \\}. A {@code \\} right before
 * {@code \end} does not open an empty last row. An optional spacing argument after
 * {@code \\} ({@code \\[2pt]}) is skipped.
 * </p>
 */
final class EnvironmentParser {

    private final Parser parser;

    EnvironmentParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * @param begin the {@code \begin} token, already consumed
     * @return the table
     */
    AstNode parse(Token begin) {
        String name = readName(begin);
        EnvironmentKind kind = EnvironmentKind.fromName(name).orElseThrow(() ->
                CompileException.invalidArgument("Unknown environment: " + name, begin.position()));
        TokenStream tokens = parser.tokens();

        List<List<AstNode>> rows = new ArrayList<>();
        List<AstNode> row = new ArrayList<>();
        try {
            parser.enterEnvironment(begin);
            while (true) {
                row.add(RowNode.wrap(parser.parseCell(kind.hasExpressionCells())));
                Token separator = tokens.peek();
                if (separator.is(TokenKind.AMPERSAND)) {
                    tokens.advance();
                } else if (separator.is(TokenKind.LINE_BREAK)) {
                    tokens.advance();
                    skipRowSpacing(tokens);
                    rows.add(row);
                    row = new ArrayList<>();
                } else if (separator.isCommand("end")) {
                    tokens.advance();
                    String endName = readName(separator);
                    if (!endName.equals(name)) {
                        throw CompileException.invalidArgument(
                                "Environment " + name + " ended by \\end{" + endName + "}", separator.position());
                    }
                    break;
                } else {
                    throw parser.unexpectedTerminator(separator);
                }
            }
        } finally {
            parser.exitEnvironment();
        }

        boolean trailingEmptyRow = !rows.isEmpty() && row.size() == 1
                && row.get(0) instanceof RowNode cell && cell.isEmpty();
        if (!trailingEmptyRow) {
            rows.add(row);
        }
        return new MatrixNode(kind, rows);
    }

    /**
     * Reads {@code {name}}: letters with an optional trailing {@code *}.
     */
    private String readName(Token command) {
        Token open = parser.tokens().peek();
        if (!open.is(TokenKind.LEFT_BRACE)) {
            throw CompileException.missingArgument(command.value(), command.position());
        }
        Parser.RawArgument argument = parser.readRawArgument(command);
        StringBuilder name = new StringBuilder();
        List<Token> content = argument.tokens();
        for (int i = 0; i < content.size(); i++) {
            Token token = content.get(i);
            boolean trailingStar = token.isOperator("*") && i == content.size() - 1 && name.length() > 0;
            if (!token.is(TokenKind.IDENTIFIER) && !trailingStar) {
                throw CompileException.invalidArgument("Invalid environment name", token.position());
            }
            name.append(token.value());
        }
        if (name.length() == 0) {
            throw CompileException.invalidArgument("Empty environment name", open.position());
        }
        return name.toString();
    }

    private static void skipRowSpacing(TokenStream tokens) {
        if (!tokens.check(TokenKind.LEFT_BRACKET)) {
            return;
        }
        int mark = tokens.mark();
        tokens.advance();
        while (!tokens.isAtEnd() && !tokens.check(TokenKind.RIGHT_BRACKET)) {
            Token token = tokens.peek();
            if (!token.is(TokenKind.NUMBER) && !token.is(TokenKind.IDENTIFIER) && !token.isOperator("-")
                    && !token.isOperator(".")) {
                // not a length: the bracket starts the next cell
                tokens.reset(mark);
                return;
            }
            tokens.advance();
        }
        if (tokens.isAtEnd()) {
            tokens.reset(mark);
            return;
        }
        tokens.advance();
    }
}

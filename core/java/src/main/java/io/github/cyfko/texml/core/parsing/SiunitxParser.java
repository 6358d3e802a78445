package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.ast.SINumberNode;
import io.github.cyfko.texml.core.ast.SIUnitNode;
import io.github.cyfko.texml.core.ast.SIValueNode;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.model.SIPrefixKind;
import io.github.cyfko.texml.core.model.SIUnitComponent;
import io.github.cyfko.texml.core.model.SIUnitKind;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.model.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles {@code \num}, {@code \si}/<code>&#92;unit</code> and {@code \SI}/{@code \qty}.
 * <p>
 * A unit argument may mix longform commands ({@code \kilo\meter\per\second\squared}) and
 * shorthand runs ({@code km/s^2}); runs are delegated to {@link UnitShorthandParser}.
 * </p>
 */
final class SiunitxParser {

    private final Parser parser;

    SiunitxParser(Parser parser) {
        this.parser = parser;
    }

    Optional<AstNode> parse(Token command, CommandInfo info) {
        return switch (command.value()) {
            case "num" -> Optional.of(new SINumberNode(readNumber(command)));
            case "si", "unit" -> Optional.of(readUnit(command));
            default -> {
                String value = readNumber(command);
                yield Optional.of(new SIValueNode(value, readUnit(command)));
            }
        };
    }

    private String readNumber(Token command) {
        Parser.RawArgument argument = parser.readRawArgument(command);
        StringBuilder number = new StringBuilder();
        for (Token token : argument.tokens()) {
            if (token.is(TokenKind.COMMAND)) {
                // thin spaces used as digit group separators are dropped
                if (SymbolTable.spaceWidth(token.value()).isEmpty()) {
                    number.append(SymbolTable.operators().getOrDefault(token.value(), token.toSource()));
                }
            } else if (!token.is(TokenKind.LEFT_BRACE) && !token.is(TokenKind.RIGHT_BRACE)) {
                number.append(token.value());
            }
        }
        if (number.length() == 0) {
            throw CompileException.invalidNumber("Empty number", command.position());
        }
        return number.toString();
    }

    private SIUnitNode readUnit(Token command) {
        Parser.RawArgument argument = parser.readRawArgument(command);
        UnitBuilder builder = new UnitBuilder();
        List<Token> content = argument.tokens();

        StringBuilder run = new StringBuilder();
        int runStart = -1;
        Token previous = null;
        int braceDepth = 0;

        for (int i = 0; i < content.size(); i++) {
            Token token = content.get(i);
            if (token.is(TokenKind.COMMAND) && SymbolTable.greek().containsKey(token.value())) {
                // \mu, \Omega: letters of a shorthand run
                if (runStart < 0) {
                    runStart = token.position();
                }
                separateWords(run, previous, token, braceDepth);
                run.append(SymbolTable.greekLetter(token.value()));
                previous = token;
                continue;
            }
            if (token.is(TokenKind.COMMAND)) {
                builder.addShorthand(run, runStart);
                run.setLength(0);
                runStart = -1;
                previous = null;
                i = applyCommand(builder, token, content, i);
                continue;
            }
            if (runStart < 0) {
                runStart = token.position();
            }
            separateWords(run, previous, token, braceDepth);
            if (token.is(TokenKind.LEFT_BRACE)) {
                braceDepth++;
            } else if (token.is(TokenKind.RIGHT_BRACE)) {
                braceDepth--;
            }
            run.append(token.value());
            previous = token;
        }
        builder.addShorthand(run, runStart);
        return builder.build(command);
    }

    /**
     * Whitespace between two unit symbols of a run ({@code m s}) separates them like {@code .}.
     */
    private static void separateWords(StringBuilder run, Token previous, Token token, int braceDepth) {
        if (previous == null || braceDepth > 0 || token.position() <= previous.end()) {
            return;
        }
        boolean previousEndsSymbol = previous.is(TokenKind.IDENTIFIER) || previous.is(TokenKind.NUMBER)
                || previous.is(TokenKind.RIGHT_BRACE) || previous.is(TokenKind.COMMAND);
        boolean tokenStartsSymbol = token.is(TokenKind.IDENTIFIER) || token.is(TokenKind.COMMAND);
        if (previousEndsSymbol && tokenStartsSymbol) {
            run.append('.');
        }
    }

    /**
     * @return the index of the last token consumed
     */
    private int applyCommand(UnitBuilder builder, Token command, List<Token> content, int index) {
        String name = command.value();
        Optional<SIPrefixKind> prefix = SIPrefixKind.fromCommand(name);
        if (prefix.isPresent()) {
            builder.pendingPrefix = prefix.get();
            return index;
        }
        Optional<SIUnitKind> unit = SIUnitKind.fromCommand(name);
        if (unit.isPresent()) {
            builder.addUnit(unit.get());
            return index;
        }
        if (SymbolTable.spaceWidth(name).isPresent()) {
            return index;
        }
        switch (name) {
            case "cdot", "times" -> {
                // explicit product sign between units
            }
            case "per" -> builder.pendingPer = true;
            case "squared" -> builder.raiseLast(2, command);
            case "cubed" -> builder.raiseLast(3, command);
            case "square" -> builder.pendingPower = 2;
            case "cubic" -> builder.pendingPower = 3;
            case "tothe", "raiseto" -> {
                int end = argumentEnd(content, index, command);
                int power = parsePower(content.subList(index + 1, end + 1), command);
                if (name.equals("tothe")) {
                    builder.raiseLast(power, command);
                } else {
                    builder.pendingPower = power;
                }
                return end;
            }
            default -> builder.addCustom(name);
        }
        return index;
    }

    /**
     * Finds the end of the single argument following {@code content[index]}.
     */
    private static int argumentEnd(List<Token> content, int index, Token command) {
        int start = index + 1;
        if (start >= content.size()) {
            throw CompileException.missingArgument(command.value(), command.position());
        }
        if (!content.get(start).is(TokenKind.LEFT_BRACE)) {
            return start;
        }
        int depth = 0;
        for (int i = start; i < content.size(); i++) {
            if (content.get(i).is(TokenKind.LEFT_BRACE)) {
                depth++;
            } else if (content.get(i).is(TokenKind.RIGHT_BRACE) && --depth == 0) {
                return i;
            }
        }
        throw CompileException.unexpectedEof(command.end());
    }

    private static int parsePower(List<Token> argument, Token command) {
        StringBuilder text = new StringBuilder();
        for (Token token : argument) {
            if (!token.is(TokenKind.LEFT_BRACE) && !token.is(TokenKind.RIGHT_BRACE)) {
                text.append(token.value());
            }
        }
        int power;
        try {
            power = Integer.parseInt(text.toString());
        } catch (NumberFormatException e) {
            throw CompileException.invalidNumber("Invalid unit power: " + text, command.position());
        }
        if (power == 0) {
            throw CompileException.invalidNumber("Invalid unit power: " + text, command.position());
        }
        return power;
    }

    /**
     * Accumulates components; all powers are kept positive by moving a component with a
     * negative power to the other side.
     */
    private static final class UnitBuilder {
        private final List<SIUnitComponent> numerator = new ArrayList<>();
        private final List<SIUnitComponent> denominator = new ArrayList<>();
        private SIPrefixKind pendingPrefix;
        private Integer pendingPower;
        private boolean pendingPer;
        private List<SIUnitComponent> lastList;

        void addUnit(SIUnitKind unit) {
            SIPrefixKind prefix = pendingPrefix == null ? SIPrefixKind.NONE : pendingPrefix;
            place(SIUnitComponent.of(prefix, unit, takePower()), pendingPer);
            pendingPrefix = null;
            pendingPer = false;
        }

        void addCustom(String symbol) {
            place(SIUnitComponent.custom(symbol, takePower()), pendingPer);
            pendingPrefix = null;
            pendingPer = false;
        }

        void addShorthand(StringBuilder run, int position) {
            if (run.length() == 0) {
                return;
            }
            SIUnitNode parsed = UnitShorthandParser.parse(run.toString(), position);
            List<SIUnitComponent> above = new ArrayList<>(parsed.numerator());
            if (pendingPrefix != null && !above.isEmpty()) {
                SIUnitComponent first = above.get(0);
                if (!first.isCustom() && first.prefix() == SIPrefixKind.NONE) {
                    above.set(0, SIUnitComponent.of(pendingPrefix, first.unit(), first.power()));
                }
            }
            boolean flip = pendingPer;
            above.forEach(component -> place(component, flip));
            parsed.denominator().forEach(component -> place(component, !flip));
            pendingPrefix = null;
            pendingPer = false;
        }

        void raiseLast(int power, Token command) {
            if (lastList == null || lastList.isEmpty()) {
                throw CompileException.invalidArgument(command.toSource() + " must follow a unit", command.position());
            }
            SIUnitComponent last = lastList.remove(lastList.size() - 1);
            place(last.withPower(last.power() * power), lastList == denominator);
        }

        private int takePower() {
            int power = pendingPower == null ? 1 : pendingPower;
            pendingPower = null;
            return power;
        }

        private void place(SIUnitComponent component, boolean inDenominator) {
            boolean below = inDenominator ^ component.power() < 0;
            lastList = below ? denominator : numerator;
            lastList.add(component.withPower(Math.abs(component.power())));
        }

        SIUnitNode build(Token command) {
            if (pendingPrefix != null) {
                throw CompileException.invalidArgument(
                        "Prefix \\" + pendingPrefix.command() + " without a unit", command.position());
            }
            return new SIUnitNode(numerator, denominator);
        }
    }
}

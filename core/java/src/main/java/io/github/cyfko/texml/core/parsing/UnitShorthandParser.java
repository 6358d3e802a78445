package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.SIUnitNode;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.model.SIPrefixKind;
import io.github.cyfko.texml.core.model.SIUnitComponent;
import io.github.cyfko.texml.core.model.SIUnitKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses compact unit strings such as {@code km.s^{-2}} or {@code kg.m/s^2}.
 * <p>
 * Segments are separated by {@code .}; a {@code /} sends every following segment to the
 * denominator. Each segment is a unit symbol, optionally preceded by a prefix symbol and
 * followed by {@code ^n} or {@code ^{n}}. A negative power moves the component to the other
 * side of the fraction bar.
 * </p>
 *
 * <h2>Symbol Resolution</h2>
 * <ol>
 *   <li>the whole segment as a unit symbol ({@code Pa}, {@code cd}, {@code m})</li>
 *   <li>the prefix {@code da}, then {@code µ}/{@code μ}, then a one-letter prefix, followed by a unit symbol</li>
 *   <li>otherwise a custom unit printed as written, without prefix</li>
 * </ol>
 *
 * <pre>{@code
 * UnitShorthandParser.parse("km.s^{-2}", 0);
 * // numerator [km], denominator [s^2]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class UnitShorthandParser {

    private UnitShorthandParser() {
        // utility class
    }

    /**
     * @param text     the shorthand expression
     * @param position source position reported in errors
     * @return the components split into numerator and denominator, with positive powers
     * @throws CompileException {@code InvalidNumber} on a power that is not a non-zero integer
     */
    public static SIUnitNode parse(String text, int position) {
        List<SIUnitComponent> numerator = new ArrayList<>();
        List<SIUnitComponent> denominator = new ArrayList<>();

        String[] parts = text.split("/", -1);
        for (int part = 0; part < parts.length; part++) {
            boolean inDenominator = part > 0;
            for (String segment : parts[part].split("\\.")) {
                String trimmed = segment.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                SIUnitComponent component = parseSegment(trimmed, position);
                boolean below = inDenominator ^ component.power() < 0;
                SIUnitComponent positive = component.withPower(Math.abs(component.power()));
                (below ? denominator : numerator).add(positive);
            }
        }
        return new SIUnitNode(numerator, denominator);
    }

    private static SIUnitComponent parseSegment(String segment, int position) {
        int caret = segment.indexOf('^');
        String symbol = caret < 0 ? segment : segment.substring(0, caret);
        int power = caret < 0 ? 1 : parsePower(segment.substring(caret + 1), position);
        if (symbol.isEmpty()) {
            throw CompileException.invalidArgument("Missing unit before power in: " + segment, position);
        }
        return resolve(symbol, power);
    }

    private static int parsePower(String text, int position) {
        String digits = text.trim();
        if (digits.startsWith("{") && digits.endsWith("}") && digits.length() >= 2) {
            digits = digits.substring(1, digits.length() - 1).trim();
        }
        int power;
        try {
            power = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw CompileException.invalidNumber("Invalid unit power: " + text, position);
        }
        if (power == 0) {
            throw CompileException.invalidNumber("Invalid unit power: " + text, position);
        }
        return power;
    }

    /**
     * Resolves a symbol without power, e.g. {@code km} or {@code Hz}.
     */
    static SIUnitComponent resolve(String symbol, int power) {
        Optional<SIUnitKind> exact = SIUnitKind.fromSymbol(symbol);
        if (exact.isPresent()) {
            return SIUnitComponent.of(SIPrefixKind.NONE, exact.get(), power);
        }
        for (String prefix : candidatePrefixes(symbol)) {
            Optional<SIUnitKind> unit = SIUnitKind.fromSymbol(symbol.substring(prefix.length()));
            Optional<SIPrefixKind> prefixKind = SIPrefixKind.fromSymbol(prefix);
            if (unit.isPresent() && prefixKind.isPresent()) {
                return SIUnitComponent.of(prefixKind.get(), unit.get(), power);
            }
        }
        return SIUnitComponent.custom(symbol, power);
    }

    private static List<String> candidatePrefixes(String symbol) {
        List<String> prefixes = new ArrayList<>(2);
        if (symbol.startsWith("da")) {
            prefixes.add("da");
        }
        if (symbol.length() > 1) {
            prefixes.add(symbol.substring(0, Character.charCount(symbol.codePointAt(0))));
        }
        return prefixes;
    }
}

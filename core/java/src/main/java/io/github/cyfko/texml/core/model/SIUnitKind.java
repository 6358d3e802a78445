package io.github.cyfko.texml.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Units understood by {@code \si} and {@code \SI}, with their printed symbol and the
 * longform command names that select them.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SIUnitKind {
    METER("m", "meter", "metre"),
    SECOND("s", "second"),
    KILOGRAM("kg", "kilogram"),
    GRAM("g", "gram"),
    AMPERE("A", "ampere"),
    KELVIN("K", "kelvin"),
    MOLE("mol", "mole"),
    CANDELA("cd", "candela"),
    HERTZ("Hz", "hertz"),
    NEWTON("N", "newton"),
    PASCAL("Pa", "pascal"),
    JOULE("J", "joule"),
    WATT("W", "watt"),
    COULOMB("C", "coulomb"),
    VOLT("V", "volt"),
    FARAD("F", "farad"),
    OHM("Ω", "ohm"),
    SIEMENS("S", "siemens"),
    WEBER("Wb", "weber"),
    TESLA("T", "tesla"),
    HENRY("H", "henry"),
    LUMEN("lm", "lumen"),
    LUX("lx", "lux"),
    BECQUEREL("Bq", "becquerel"),
    GRAY("Gy", "gray"),
    SIEVERT("Sv", "sievert"),
    LITRE("L", "litre", "liter"),
    ELECTRONVOLT("eV", "electronvolt"),
    DEGREE_CELSIUS("°C", "degreeCelsius"),
    /** A unit outside this table; its text lives in {@link SIUnitComponent#customSymbol()}. */
    CUSTOM("");

    private static final Map<String, SIUnitKind> BY_COMMAND = Arrays.stream(values())
            .flatMap(kind -> kind.commands.stream().map(command -> Map.entry(command, kind)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private static final Map<String, SIUnitKind> BY_SYMBOL = Arrays.stream(values())
            .filter(kind -> kind != CUSTOM)
            .collect(Collectors.toUnmodifiableMap(SIUnitKind::symbol, Function.identity()));

    private final String symbol;
    private final List<String> commands;

    SIUnitKind(String symbol, String... commands) {
        this.symbol = symbol;
        this.commands = List.of(commands);
    }

    public String symbol() {
        return symbol;
    }

    public List<String> commands() {
        return commands;
    }

    public static Optional<SIUnitKind> fromCommand(String command) {
        return Optional.ofNullable(BY_COMMAND.get(command));
    }

    /**
     * Exact symbol lookup, e.g. {@code "Hz"} or {@code "m"}.
     */
    public static Optional<SIUnitKind> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}

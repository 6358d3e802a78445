package io.github.cyfko.texml.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decimal SI prefixes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SIPrefixKind {
    NONE("", 0, ""),
    YOCTO("y", -24, "yocto"),
    ZEPTO("z", -21, "zepto"),
    ATTO("a", -18, "atto"),
    FEMTO("f", -15, "femto"),
    PICO("p", -12, "pico"),
    NANO("n", -9, "nano"),
    MICRO("μ", -6, "micro"),
    MILLI("m", -3, "milli"),
    CENTI("c", -2, "centi"),
    DECI("d", -1, "deci"),
    DECA("da", 1, "deca"),
    HECTO("h", 2, "hecto"),
    KILO("k", 3, "kilo"),
    MEGA("M", 6, "mega"),
    GIGA("G", 9, "giga"),
    TERA("T", 12, "tera"),
    PETA("P", 15, "peta"),
    EXA("E", 18, "exa"),
    ZETTA("Z", 21, "zetta"),
    YOTTA("Y", 24, "yotta");

    /** U+00B5 MICRO SIGN, accepted in shorthand next to the Greek mu. */
    public static final String MICRO_SIGN = "µ";

    private static final Map<String, SIPrefixKind> BY_COMMAND = Arrays.stream(values())
            .filter(kind -> kind != NONE)
            .collect(Collectors.toUnmodifiableMap(SIPrefixKind::command, kind -> kind));

    private final String symbol;
    private final int exponent;
    private final String command;

    SIPrefixKind(String symbol, int exponent, String command) {
        this.symbol = symbol;
        this.exponent = exponent;
        this.command = command;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return the power of ten this prefix stands for
     */
    public int exponent() {
        return exponent;
    }

    public String command() {
        return command;
    }

    public static Optional<SIPrefixKind> fromCommand(String command) {
        if ("deka".equals(command)) {
            return Optional.of(DECA);
        }
        return Optional.ofNullable(BY_COMMAND.get(command));
    }

    /**
     * Shorthand symbol lookup. Both the micro sign and the Greek mu select {@link #MICRO}.
     */
    public static Optional<SIPrefixKind> fromSymbol(String symbol) {
        if (MICRO_SIGN.equals(symbol)) {
            return Optional.of(MICRO);
        }
        return Arrays.stream(values())
                .filter(kind -> kind != NONE && kind.symbol.equals(symbol))
                .findFirst();
    }
}

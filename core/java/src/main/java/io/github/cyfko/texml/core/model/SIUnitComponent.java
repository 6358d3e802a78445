package io.github.cyfko.texml.core.model;

import java.util.Objects;

/**
 * One multiplicative term of a unit expression, such as {@code km} or {@code s^2}.
 *
 * @param unit         the unit, or {@link SIUnitKind#CUSTOM}
 * @param customSymbol printed text of a custom unit, empty otherwise
 * @param prefix       decimal prefix, {@link SIPrefixKind#NONE} for custom units
 * @param power        exponent; the sign records whether the term belongs to the denominator
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SIUnitComponent(SIUnitKind unit, String customSymbol, SIPrefixKind prefix, int power) {

    public SIUnitComponent {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(prefix, "prefix");
        customSymbol = customSymbol == null ? "" : customSymbol;
        if (unit == SIUnitKind.CUSTOM) {
            if (customSymbol.isBlank()) {
                throw new IllegalArgumentException("A custom unit needs a symbol");
            }
            if (prefix != SIPrefixKind.NONE) {
                throw new IllegalArgumentException("A custom unit never carries a prefix");
            }
        }
        if (power == 0) {
            throw new IllegalArgumentException("power must not be zero");
        }
    }

    public static SIUnitComponent of(SIPrefixKind prefix, SIUnitKind unit, int power) {
        return new SIUnitComponent(unit, "", prefix, power);
    }

    public static SIUnitComponent of(SIUnitKind unit) {
        return of(SIPrefixKind.NONE, unit, 1);
    }

    public static SIUnitComponent custom(String symbol, int power) {
        return new SIUnitComponent(SIUnitKind.CUSTOM, symbol, SIPrefixKind.NONE, power);
    }

    public SIUnitComponent withPower(int newPower) {
        return new SIUnitComponent(unit, customSymbol, prefix, newPower);
    }

    public boolean isCustom() {
        return unit == SIUnitKind.CUSTOM;
    }

    /**
     * @return the printed symbol, prefix included, e.g. {@code km}
     */
    public String symbol() {
        return isCustom() ? customSymbol : prefix.symbol() + unit.symbol();
    }
}

package io.github.cyfko.texml.core.generator;

import io.github.cyfko.texml.core.ast.StyleKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps letters, digits and Greek letters to the Mathematical Alphanumeric Symbols block
 * (U+1D400 to U+1D7FF).
 * <p>
 * Some styled letters were encoded earlier in the Letterlike Symbols block (ℝ, ℬ, ℌ, ...);
 * the corresponding slots of the alphanumeric block are empty and the exceptions below take
 * precedence.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StyledCharacters {

    /** First code points of a style: capital A, small a, digit zero, capital Alpha, small alpha. */
    private record Ranges(int upper, int lower, int digit, int greekUpper, int greekLower) {}

    private static final int NONE = -1;

    private static final Map<StyleKind, Ranges> RANGES = new EnumMap<>(StyleKind.class);
    private static final Map<StyleKind, Map<Character, Integer>> EXCEPTIONS = new EnumMap<>(StyleKind.class);

    static {
        RANGES.put(StyleKind.BOLD, new Ranges(0x1D400, 0x1D41A, 0x1D7CE, 0x1D6A8, 0x1D6C2));
        RANGES.put(StyleKind.ITALIC, new Ranges(0x1D434, 0x1D44E, NONE, 0x1D6E2, 0x1D6FC));
        RANGES.put(StyleKind.BOLD_ITALIC, new Ranges(0x1D468, 0x1D482, 0x1D7CE, 0x1D71C, 0x1D736));
        RANGES.put(StyleKind.SCRIPT, new Ranges(0x1D49C, 0x1D4B6, NONE, NONE, NONE));
        RANGES.put(StyleKind.FRAKTUR, new Ranges(0x1D504, 0x1D51E, NONE, NONE, NONE));
        RANGES.put(StyleKind.DOUBLE_STRUCK, new Ranges(0x1D538, 0x1D552, 0x1D7D8, NONE, NONE));
        RANGES.put(StyleKind.SANS_SERIF, new Ranges(0x1D5A0, 0x1D5BA, 0x1D7E2, NONE, NONE));
        RANGES.put(StyleKind.MONOSPACE, new Ranges(0x1D670, 0x1D68A, 0x1D7F6, NONE, NONE));

        EXCEPTIONS.put(StyleKind.ITALIC, Map.of('h', 0x210E));
        EXCEPTIONS.put(StyleKind.SCRIPT, Map.ofEntries(
                Map.entry('B', 0x212C), Map.entry('E', 0x2130), Map.entry('F', 0x2131),
                Map.entry('H', 0x210B), Map.entry('I', 0x2110), Map.entry('L', 0x2112),
                Map.entry('M', 0x2133), Map.entry('R', 0x211B), Map.entry('e', 0x212F),
                Map.entry('g', 0x210A), Map.entry('o', 0x2134)));
        EXCEPTIONS.put(StyleKind.FRAKTUR, Map.of(
                'C', 0x212D, 'H', 0x210C, 'I', 0x2111, 'R', 0x211C, 'Z', 0x2128));
        EXCEPTIONS.put(StyleKind.DOUBLE_STRUCK, Map.of(
                'C', 0x2102, 'H', 0x210D, 'N', 0x2115, 'P', 0x2119, 'Q', 0x211A, 'R', 0x211D, 'Z', 0x2124));
    }

    private StyledCharacters() {
        // static tables only
    }

    /**
     * Styles every letter and digit of a string.
     *
     * @param style the alphabet
     * @param text  plain text, e.g. {@code R} or {@code 12}
     * @return the styled text, or empty if some letter or digit has no styled form
     */
    public static Optional<String> apply(StyleKind style, String text) {
        Ranges ranges = RANGES.get(style);
        if (ranges == null || text.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder styled = new StringBuilder(text.length() * 2);
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            int mapped = map(style, ranges, codePoint);
            if (mapped == NONE) {
                return Optional.empty();
            }
            styled.appendCodePoint(mapped);
        }
        return Optional.of(styled.toString());
    }

    private static int map(StyleKind style, Ranges ranges, int codePoint) {
        Map<Character, Integer> exceptions = EXCEPTIONS.getOrDefault(style, Map.of());
        if (codePoint < 0x10000 && exceptions.containsKey((char) codePoint)) {
            return exceptions.get((char) codePoint);
        }
        if (codePoint >= 'A' && codePoint <= 'Z') {
            return ranges.upper() + (codePoint - 'A');
        }
        if (codePoint >= 'a' && codePoint <= 'z') {
            return ranges.lower() + (codePoint - 'a');
        }
        if (codePoint >= '0' && codePoint <= '9') {
            return ranges.digit() == NONE ? NONE : ranges.digit() + (codePoint - '0');
        }
        if (codePoint >= 0x0391 && codePoint <= 0x03A9) {
            return ranges.greekUpper() == NONE ? NONE : ranges.greekUpper() + (codePoint - 0x0391);
        }
        if (codePoint >= 0x03B1 && codePoint <= 0x03C9) {
            return ranges.greekLower() == NONE ? NONE : ranges.greekLower() + (codePoint - 0x03B1);
        }
        if (Character.isLetterOrDigit(codePoint)) {
            return NONE;
        }
        // punctuation inside a number, e.g. the decimal point
        return codePoint;
    }
}

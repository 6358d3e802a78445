package io.github.cyfko.texml.core.spi;

import io.github.cyfko.texml.core.parsing.SymbolTable;
import io.github.cyfko.texml.core.spi.UnicodeMapping.Category;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in {@link UnicodeSymbolTable}.
 * <p>
 * Greek letters are derived from the parser's Greek table so both directions stay in sync;
 * the remaining characters are listed explicitly. The table is immutable and shared.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DefaultUnicodeSymbolTable implements UnicodeSymbolTable {

    private static final DefaultUnicodeSymbolTable INSTANCE = new DefaultUnicodeSymbolTable();

    private final Map<Integer, UnicodeMapping> mappings;

    private DefaultUnicodeSymbolTable() {
        Map<Integer, UnicodeMapping> map = new HashMap<>();

        SymbolTable.greek().forEach((name, letter) -> put(map, letter, name, Category.GREEK_LETTER));

        put(map, "∞", "infty", Category.SYMBOL);
        put(map, "∂", "partial", Category.SYMBOL);
        put(map, "∇", "nabla", Category.SYMBOL);
        put(map, "∅", "emptyset", Category.SYMBOL);
        put(map, "∀", "forall", Category.SYMBOL);
        put(map, "∃", "exists", Category.SYMBOL);
        put(map, "∄", "nexists", Category.SYMBOL);
        put(map, "ℏ", "hbar", Category.SYMBOL);
        put(map, "ℓ", "ell", Category.SYMBOL);
        put(map, "ℵ", "aleph", Category.SYMBOL);
        put(map, "∠", "angle", Category.SYMBOL);
        put(map, "′", "prime", Category.SYMBOL);
        put(map, "°", "degree", Category.SYMBOL);
        put(map, "…", "ldots", Category.SYMBOL);
        put(map, "⋯", "cdots", Category.SYMBOL);
        put(map, "⋮", "vdots", Category.SYMBOL);
        put(map, "⋱", "ddots", Category.SYMBOL);

        put(map, "∑", "sum", Category.BIG_OPERATOR);
        put(map, "∏", "prod", Category.BIG_OPERATOR);
        put(map, "∐", "coprod", Category.BIG_OPERATOR);
        put(map, "∫", "int", Category.BIG_OPERATOR);
        put(map, "∬", "iint", Category.BIG_OPERATOR);
        put(map, "∭", "iiint", Category.BIG_OPERATOR);
        put(map, "∮", "oint", Category.BIG_OPERATOR);
        put(map, "⋃", "bigcup", Category.BIG_OPERATOR);
        put(map, "⋂", "bigcap", Category.BIG_OPERATOR);

        put(map, "√", "sqrt", Category.COMMAND);

        for (String operator : new String[]{"×", "÷", "±", "∓", "⋅", "·", "∗", "⋆", "∘", "•", "⊕", "⊗",
                "⊖", "⊙", "∪", "∩", "∧", "∨", "¬", "∖", "−"}) {
            put(map, operator, operator, Category.OPERATOR);
        }
        for (String relation : new String[]{"≤", "≥", "≠", "≈", "≡", "∼", "≃", "≅", "≪", "≫", "∝", "⊥",
                "∥", "∈", "∉", "∋", "⊂", "⊃", "⊆", "⊇", "→", "←", "↔", "⇒", "⇐", "⇔", "↦", "⟶", "⟹",
                "↑", "↓"}) {
            put(map, relation, relation, Category.RELATION);
        }

        String[] superscriptDigits = {"⁰", "¹", "²", "³", "⁴", "⁵", "⁶", "⁷", "⁸", "⁹"};
        String[] subscriptDigits = {"₀", "₁", "₂", "₃", "₄", "₅", "₆", "₇", "₈", "₉"};
        for (int digit = 0; digit < 10; digit++) {
            put(map, superscriptDigits[digit], String.valueOf(digit), Category.SUPERSCRIPT);
            put(map, subscriptDigits[digit], String.valueOf(digit), Category.SUBSCRIPT);
        }
        put(map, "ⁱ", "i", Category.SUPERSCRIPT);
        put(map, "ⁿ", "n", Category.SUPERSCRIPT);

        String subscriptLetters = "ₐaₑeₒoₓxₕhₖkₗlₘmₙnₚpₛsₜtᵢiᵣrᵤuᵥvⱼj";
        for (int i = 0; i < subscriptLetters.length(); i += 2) {
            put(map, subscriptLetters.substring(i, i + 1), subscriptLetters.substring(i + 1, i + 2), Category.SUBSCRIPT);
        }

        this.mappings = Map.copyOf(map);
    }

    public static DefaultUnicodeSymbolTable getInstance() {
        return INSTANCE;
    }

    @Override
    public Optional<UnicodeMapping> lookup(int codePoint) {
        return Optional.ofNullable(mappings.get(codePoint));
    }

    /**
     * @return number of mapped characters
     */
    public int size() {
        return mappings.size();
    }

    private static void put(Map<Integer, UnicodeMapping> map, String character, String latex, Category category) {
        map.put(character.codePointAt(0), new UnicodeMapping(latex, category));
    }
}

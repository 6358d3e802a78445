package io.github.cyfko.texml.core.spi;

import io.github.cyfko.texml.core.spi.UnicodeMapping.Category;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultUnicodeSymbolTable}.
 */
@DisplayName("DefaultUnicodeSymbolTable Tests")
class DefaultUnicodeSymbolTableTest {

    private final DefaultUnicodeSymbolTable table = DefaultUnicodeSymbolTable.getInstance();

    @ParameterizedTest(name = "{0} -> {1} ({2})")
    @CsvSource({
            "α, alpha, GREEK_LETTER",
            "Ω, Omega, GREEK_LETTER",
            "∞, infty, SYMBOL",
            "∑, sum, BIG_OPERATOR",
            "√, sqrt, COMMAND",
            "×, ×, OPERATOR",
            "≤, ≤, RELATION",
            "², 2, SUPERSCRIPT",
            "ₙ, n, SUBSCRIPT"
    })
    @DisplayName("Should map characters to their LaTeX equivalent")
    void testLookup(String character, String latex, Category category) {
        UnicodeMapping mapping = table.lookup(character.codePointAt(0)).orElseThrow();

        assertEquals(latex, mapping.latex());
        assertEquals(category, mapping.category());
    }

    @Test
    @DisplayName("Should return empty for unmapped characters")
    void testUnmapped() {
        assertTrue(table.lookup('é').isEmpty());
        assertTrue(table.lookup(0x2603).isEmpty());
    }

    @Test
    @DisplayName("Should be a shared instance covering the Greek alphabet")
    void testSingleton() {
        assertSame(table, DefaultUnicodeSymbolTable.getInstance());
        assertTrue(table.size() > 100);
    }

    @Test
    @DisplayName("Should validate mappings")
    void testMappingValidation() {
        assertThrows(IllegalArgumentException.class, () -> new UnicodeMapping("", Category.SYMBOL));
        assertThrows(NullPointerException.class, () -> new UnicodeMapping("x", null));
        assertTrue(Category.GREEK_LETTER.isCommand());
        assertFalse(Category.RELATION.isCommand());
        assertTrue(Category.SUBSCRIPT.isScript());
    }
}

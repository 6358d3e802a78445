package io.github.cyfko.texml.core.spi;

import io.github.cyfko.texml.core.model.MacroDefinition;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.parsing.Lexer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MacroRegistry}.
 */
@DisplayName("MacroRegistry Tests")
class MacroRegistryTest {

    private MacroRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new MacroRegistry();
    }

    private static MacroDefinition macro(String name, String body) {
        List<Token> tokens = Lexer.standard().lex(body);
        return new MacroDefinition(name, 0, tokens.subList(0, tokens.size() - 1));
    }

    @Test
    @DisplayName("Should look up a defined macro")
    void testDefineAndLookup() {
        registry.define(macro("R", "\\mathbb{R}"));

        assertTrue(registry.contains("R"));
        assertEquals("mathbb", registry.lookup("R").orElseThrow().body().get(0).value());
        assertTrue(registry.lookup("S").isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
        assertEquals(Set.of("R"), registry.names());
    }

    @Test
    @DisplayName("Should replace an existing definition and bump the version")
    void testRedefinition() {
        // Given
        registry.define(macro("R", "x"));
        long before = registry.version();

        // When
        registry.define(macro("R", "y"));

        // Then
        assertEquals(1, registry.size());
        assertEquals("y", registry.lookup("R").orElseThrow().body().get(0).value());
        assertTrue(registry.version() > before);
    }

    @Test
    @DisplayName("Should keep the version when an identical definition is repeated")
    void testIdenticalRedefinition() {
        registry.define(macro("R", "x"));
        long before = registry.version();

        registry.define(macro("R", "x"));

        assertEquals(before, registry.version());
    }

    @Test
    @DisplayName("Should only add absent definitions")
    void testDefineIfAbsent() {
        assertTrue(registry.defineIfAbsent(macro("R", "x")));
        assertFalse(registry.defineIfAbsent(macro("R", "y")));
        assertEquals("x", registry.lookup("R").orElseThrow().body().get(0).value());
    }

    @Test
    @DisplayName("Should remove and clear definitions")
    void testRemoveAndClear() {
        registry.define(macro("A", "a"));
        registry.define(macro("B", "b"));

        assertTrue(registry.remove("A"));
        assertFalse(registry.remove("A"));
        registry.clear();

        assertTrue(registry.isEmpty());
    }

    @Test
    @DisplayName("Should copy into an independent registry")
    void testCopy() {
        // Given
        registry.define(macro("A", "a"));

        // When
        MacroRegistry copy = registry.copy();
        copy.define(macro("B", "b"));

        // Then
        assertTrue(copy.contains("A"));
        assertFalse(registry.contains("B"));
    }
}

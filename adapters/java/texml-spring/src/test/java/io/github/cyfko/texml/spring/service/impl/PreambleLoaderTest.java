package io.github.cyfko.texml.spring.service.impl;

import io.github.cyfko.texml.core.model.MacroDefinition;
import io.github.cyfko.texml.core.spi.MacroRegistry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PreambleLoader}.
 */
class PreambleLoaderTest {

    @Test
    void shouldDefineOneMacroPerEntry() {
        Map<String, String> macros = new LinkedHashMap<>();
        macros.put("R", "\\mathbb{R}");
        macros.put("\\norm", "\\left\\| #1 \\right\\|");

        MacroRegistry registry = PreambleLoader.load(macros);

        assertEquals(2, registry.size());
        assertEquals(0, registry.lookup("R").map(MacroDefinition::arity).orElseThrow());
        assertEquals(1, registry.lookup("norm").map(MacroDefinition::arity).orElseThrow());
    }

    @Test
    void shouldTakeHighestParameterAsArity() {
        MacroDefinition definition = PreambleLoader.toDefinition("pair", "(#2, #1)");

        assertEquals(2, definition.arity());
        assertFalse(definition.body().isEmpty(), "Body should keep its tokens");
    }

    @Test
    void shouldAcceptEmptyBodiesAndMissingMap() {
        assertTrue(PreambleLoader.load(null).isEmpty());
        assertTrue(PreambleLoader.toDefinition("nothing", "").body().isEmpty());
    }

    @Test
    void shouldRejectBodiesThatCannotBeTokenized() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> PreambleLoader.load(Map.of("bad", "a \\")));

        assertTrue(e.getMessage().startsWith("Invalid body for preamble macro \\bad"));
    }
}

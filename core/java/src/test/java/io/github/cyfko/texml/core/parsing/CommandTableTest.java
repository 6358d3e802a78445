package io.github.cyfko.texml.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CommandTable}.
 */
@DisplayName("CommandTable Tests")
class CommandTableTest {

    private final CommandTable table = CommandTable.standard();

    @ParameterizedTest(name = "\\{0} -> {1}/{2}")
    @CsvSource({
            "frac, FRACTION, 2",
            "binom, BINOMIAL, 2",
            "over, INFIX_FRACTION, 0",
            "sqrt, SQRT, 1",
            "alpha, GREEK, 0",
            "le, OPERATOR, 0",
            "infty, SYMBOL, 0",
            "langle, FENCE, 0",
            "mathbb, STYLE, 1",
            "textbf, TEXT, 1",
            "hat, ACCENT, 1",
            "sum, BIG_OPERATOR, 0",
            "sin, FUNCTION, 0",
            "left, DELIMITER, 1",
            "Bigl, SIZED_DELIMITER, 1",
            "begin, ENVIRONMENT, 1",
            "quad, SPACE, 0",
            "textcolor, COLOR, 2",
            "displaystyle, MATH_STYLE, 0",
            "si, SIUNITX, 1",
            "SI, SIUNITX, 2",
            "meter, SI_UNIT, 0",
            "kilo, SI_PREFIX, 0",
            "per, SI_OPERATOR, 0",
            "newcommand, MACRO_DEFINITION, 0",
            "limits, IGNORED, 0"
    })
    @DisplayName("Should classify built-in commands")
    void testLookup(String name, CommandCategory category, int arity) {
        CommandInfo info = table.lookup(name).orElseThrow();

        assertEquals(category, info.category());
        assertEquals(arity, info.arity());
    }

    @Test
    @DisplayName("Should not know user macros")
    void testUnknown() {
        assertFalse(table.contains("R"));
        assertTrue(table.lookup("foo").isEmpty());
    }

    @Test
    @DisplayName("Should list names per category")
    void testNamesByCategory() {
        assertTrue(table.names(CommandCategory.FRACTION).containsAll(Set.of("frac", "dfrac", "tfrac", "cfrac")));
        assertTrue(table.size() > 200);
    }
}

package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.SINumberNode;
import io.github.cyfko.texml.core.ast.SIUnitNode;
import io.github.cyfko.texml.core.ast.SIValueNode;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.exception.ErrorKind;
import io.github.cyfko.texml.core.model.SIPrefixKind;
import io.github.cyfko.texml.core.model.SIUnitComponent;
import io.github.cyfko.texml.core.model.SIUnitKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.cyfko.texml.core.parsing.ParserTest.failure;
import static io.github.cyfko.texml.core.parsing.ParserTest.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the siunitx commands handled by {@link SiunitxParser}.
 */
@DisplayName("SiunitxParser Tests")
class SiunitxParserTest {

    private static final SIUnitComponent KILOMETER = SIUnitComponent.of(SIPrefixKind.KILO, SIUnitKind.METER, 1);
    private static final SIUnitComponent METER = SIUnitComponent.of(SIUnitKind.METER);
    private static final SIUnitComponent SECOND_SQUARED = SIUnitComponent.of(SIPrefixKind.NONE, SIUnitKind.SECOND, 2);

    @Nested
    @DisplayName("Units")
    class Units {

        @Test
        @DisplayName("Should give shorthand and longform the same components")
        void testShorthandMatchesLongform() {
            SIUnitNode expected = new SIUnitNode(List.of(KILOMETER), List.of());

            assertEquals(expected, parse("\\si{km}"));
            assertEquals(expected, parse("\\si{\\kilo\\meter}"));
            assertEquals(expected, parse("\\unit{\\kilo\\metre}"));
        }

        @Test
        @DisplayName("Should apply per and squared")
        void testPerSquared() {
            SIUnitNode expected = new SIUnitNode(List.of(KILOMETER), List.of(SECOND_SQUARED));

            assertEquals(expected, parse("\\si{\\kilo\\meter\\per\\second\\squared}"));
            assertEquals(expected, parse("\\si{km/s^2}"));
        }

        @Test
        @DisplayName("Should apply power prefixes and tothe")
        void testPowers() {
            assertEquals(new SIUnitNode(List.of(METER.withPower(2)), List.of()), parse("\\si{\\square\\meter}"));
            assertEquals(new SIUnitNode(List.of(METER.withPower(3)), List.of()), parse("\\si{\\meter\\tothe{3}}"));
            assertEquals(new SIUnitNode(List.of(METER.withPower(3)), List.of()), parse("\\si{\\meter\\cubed}"));
        }

        @Test
        @DisplayName("Should allow an empty numerator")
        void testPerAlone() {
            assertEquals(new SIUnitNode(List.of(), List.of(SIUnitComponent.of(SIUnitKind.SECOND))),
                    parse("\\si{\\per\\second}"));
        }

        @Test
        @DisplayName("Should treat whitespace between symbols as a product")
        void testSpaceSeparated() {
            assertEquals(new SIUnitNode(List.of(SIUnitComponent.of(SIUnitKind.NEWTON), METER), List.of()),
                    parse("\\si{N m}"));
        }

        @Test
        @DisplayName("Should accept a unit command outside siunitx")
        void testBareUnitCommand() {
            assertEquals(new SIUnitNode(List.of(METER), List.of()), parse("\\meter"));
        }

        @Test
        @DisplayName("Should reject dangling prefixes and operators")
        void testErrors() {
            CompileException prefix = failure("\\si{\\kilo}");
            assertEquals(ErrorKind.INVALID_ARGUMENT, prefix.getKind());
            assertEquals("Prefix \\kilo without a unit", prefix.getMessage());

            CompileException squared = failure("\\si{\\squared}");
            assertEquals(ErrorKind.INVALID_ARGUMENT, squared.getKind());
            assertEquals("\\squared must follow a unit", squared.getMessage());

            assertEquals(ErrorKind.INVALID_NUMBER, failure("\\si{m^x}").getKind());
        }
    }

    @Nested
    @DisplayName("Numbers and quantities")
    class Quantities {

        @Test
        @DisplayName("Should keep the number text")
        void testNumber() {
            assertEquals(new SINumberNode("1.5e3"), parse("\\num{1.5e3}"));
            assertEquals(new SINumberNode("-2"), parse("\\num{-2}"));
        }

        @Test
        @DisplayName("Should drop thin-space digit separators")
        void testDigitGroups() {
            assertEquals(new SINumberNode("12345"), parse("\\num{12\\,345}"));
        }

        @Test
        @DisplayName("Should pair a value with its unit")
        void testQuantity() {
            SIValueNode expected = new SIValueNode("3", new SIUnitNode(List.of(METER), List.of()));

            assertEquals(expected, parse("\\SI{3}{\\meter}"));
            assertEquals(expected, parse("\\qty{3}{m}"));
        }

        @Test
        @DisplayName("Should reject an empty number")
        void testEmptyNumber() {
            CompileException e = failure("\\num{}");

            assertEquals(ErrorKind.INVALID_NUMBER, e.getKind());
            assertEquals("Empty number", e.getMessage());
        }
    }
}

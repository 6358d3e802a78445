package io.github.cyfko.texml.core.generator;

import io.github.cyfko.texml.core.ast.AccentKind;
import io.github.cyfko.texml.core.ast.AccentNode;
import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.ast.BigOperatorClass;
import io.github.cyfko.texml.core.ast.BigOperatorNode;
import io.github.cyfko.texml.core.ast.BinomialNode;
import io.github.cyfko.texml.core.ast.ColorNode;
import io.github.cyfko.texml.core.ast.DelimitedNode;
import io.github.cyfko.texml.core.ast.EnvironmentKind;
import io.github.cyfko.texml.core.ast.FenceStyle;
import io.github.cyfko.texml.core.ast.FractionNode;
import io.github.cyfko.texml.core.ast.FractionStyle;
import io.github.cyfko.texml.core.ast.FunctionNode;
import io.github.cyfko.texml.core.ast.IdentifierNode;
import io.github.cyfko.texml.core.ast.LimitsMode;
import io.github.cyfko.texml.core.ast.MatrixNode;
import io.github.cyfko.texml.core.ast.NumberNode;
import io.github.cyfko.texml.core.ast.OperatorForm;
import io.github.cyfko.texml.core.ast.OperatorNode;
import io.github.cyfko.texml.core.ast.PhantomKind;
import io.github.cyfko.texml.core.ast.PhantomNode;
import io.github.cyfko.texml.core.ast.RootNode;
import io.github.cyfko.texml.core.ast.RowNode;
import io.github.cyfko.texml.core.ast.SINumberNode;
import io.github.cyfko.texml.core.ast.SIUnitNode;
import io.github.cyfko.texml.core.ast.SIValueNode;
import io.github.cyfko.texml.core.ast.SizedDelimiterNode;
import io.github.cyfko.texml.core.ast.SqrtNode;
import io.github.cyfko.texml.core.ast.StyleKind;
import io.github.cyfko.texml.core.ast.StyleNode;
import io.github.cyfko.texml.core.ast.SuperscriptNode;
import io.github.cyfko.texml.core.ast.SymbolNode;
import io.github.cyfko.texml.core.ast.TextNode;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.model.SIPrefixKind;
import io.github.cyfko.texml.core.model.SIUnitComponent;
import io.github.cyfko.texml.core.model.SIUnitKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MathMLGenerator}.
 */
@DisplayName("MathMLGenerator Tests")
class MathMLGeneratorTest {

    private static final String OPEN_INLINE = "<math xmlns=\"http://www.w3.org/1998/Math/MathML\" display=\"inline\">";

    private final MathMLGenerator generator = new MathMLGenerator();

    private static final IdentifierNode X = new IdentifierNode("x");
    private static final IdentifierNode A = new IdentifierNode("a");
    private static final IdentifierNode B = new IdentifierNode("b");

    /**
     * Output without the enclosing {@code <math>} element.
     */
    private String body(AstNode node) {
        String xml = generator.generate(node, MathMLOptions.defaults());
        assertTrue(xml.startsWith(OPEN_INLINE));
        assertTrue(xml.endsWith("</math>"));
        return xml.substring(OPEN_INLINE.length(), xml.length() - "</math>".length());
    }

    // ==================== Root element ====================

    @Test
    @DisplayName("Should always write the namespace and display attribute")
    void testRootElement() {
        assertEquals(OPEN_INLINE + "<mi>x</mi></math>", generator.generate(X, MathMLOptions.defaults()));
        assertEquals("<math xmlns=\"http://www.w3.org/1998/Math/MathML\" display=\"block\"><mi>x</mi></math>",
                generator.generate(X, MathMLOptions.block()));
    }

    @Test
    @DisplayName("Should produce identical output for identical trees")
    void testDeterminism() {
        AstNode ast = RowNode.of(new FunctionNode("sin"), new FractionNode(A, B, FractionStyle.NORMAL));

        assertEquals(generator.generate(ast, MathMLOptions.defaults()), generator.generate(ast, MathMLOptions.defaults()));
    }

    // ==================== Tokens ====================

    @Nested
    @DisplayName("Token elements")
    class Tokens {

        @Test
        @DisplayName("Should keep capital Greek letters upright")
        void testSymbols() {
            assertEquals("<mi mathvariant=\"normal\">Γ</mi>", body(new SymbolNode("Gamma", "Γ")));
            assertEquals("<mi>α</mi>", body(new SymbolNode("alpha", "α")));
        }

        @Test
        @DisplayName("Should write the form of non-infix operators")
        void testOperators() {
            assertEquals("<mo>+</mo>", body(OperatorNode.of("+", "+")));
            assertEquals("<mo form=\"postfix\">!</mo>", body(OperatorNode.postfix("!", "!")));
            assertEquals("<mo form=\"prefix\" stretchy=\"false\">(</mo>",
                    body(OperatorNode.fence("(", "(", OperatorForm.PREFIX, FenceStyle.FIXED)));
            assertEquals("<mo fence=\"true\" stretchy=\"true\">|</mo>",
                    body(OperatorNode.fence("middle", "|", OperatorForm.INFIX, FenceStyle.STRETCHY)));
        }

        @Test
        @DisplayName("Should escape markup characters")
        void testEscaping() {
            assertEquals("<mo>&lt;</mo>", body(OperatorNode.of("<", "<")));
            assertEquals("<mtext>a &amp; b</mtext>", body(new TextNode("a & b")));
        }

        @Test
        @DisplayName("Should protect leading and trailing text spaces")
        void testTextSpaces() {
            assertEquals("<mtext>\u00A0if\u00A0</mtext>", body(new TextNode(" if ")));
        }

        @Test
        @DisplayName("Should apply a function to its argument")
        void testFunctionApplication() {
            assertEquals("<mrow><mi>sin</mi><mo>⁡</mo><mspace width=\"0.1667em\"/><mi>x</mi></mrow>",
                    body(RowNode.of(new FunctionNode("sin"), X)));
            assertEquals("<mrow><mi>sin</mi><mo>⁡</mo><mrow><mo form=\"prefix\" stretchy=\"false\">(</mo>"
                            + "<mi>x</mi><mo form=\"postfix\" stretchy=\"false\">)</mo></mrow></mrow>",
                    body(RowNode.of(new FunctionNode("sin"), new DelimitedNode("(", ")", X, false))));
        }

        @Test
        @DisplayName("Should not apply a function at the end of a row")
        void testTrailingFunction() {
            assertEquals("<mrow><mi>x</mi><mi>sin</mi></mrow>", body(RowNode.of(X, new FunctionNode("sin"))));
        }
    }

    // ==================== Layout ====================

    @Nested
    @DisplayName("Layout elements")
    class Layout {

        @Test
        @DisplayName("Should wrap styled fractions in mstyle")
        void testFractions() {
            assertEquals("<mfrac><mi>a</mi><mi>b</mi></mfrac>", body(new FractionNode(A, B, FractionStyle.NORMAL)));
            assertEquals("<mstyle displaystyle=\"true\" scriptlevel=\"0\"><mfrac><mi>a</mi><mi>b</mi></mfrac></mstyle>",
                    body(new FractionNode(A, B, FractionStyle.DISPLAY)));
        }

        @Test
        @DisplayName("Should draw binomials with stretchy parentheses and no rule")
        void testBinomial() {
            assertEquals("<mrow><mo fence=\"true\" form=\"prefix\" stretchy=\"true\">(</mo>"
                            + "<mfrac linethickness=\"0\"><mi>a</mi><mi>b</mi></mfrac>"
                            + "<mo fence=\"true\" form=\"postfix\" stretchy=\"true\">)</mo></mrow>",
                    body(new BinomialNode(A, B, FractionStyle.NORMAL)));
        }

        @Test
        @DisplayName("Should write roots")
        void testRoots() {
            assertEquals("<msqrt><mi>a</mi><mo>+</mo><mi>b</mi></msqrt>",
                    body(new SqrtNode(RowNode.of(A, OperatorNode.of("+", "+"), B))));
            assertEquals("<mroot><mi>x</mi><mn>3</mn></mroot>", body(new RootNode(X, new NumberNode("3"))));
        }

        @Test
        @DisplayName("Should write accents and stack scripts on braces")
        void testAccents() {
            assertEquals("<mover accent=\"true\"><mi>x</mi><mo stretchy=\"false\">^</mo></mover>",
                    body(new AccentNode(AccentKind.HAT, X)));
            assertEquals("<mover><mover accent=\"true\"><mi>x</mi><mo stretchy=\"true\">⏞</mo></mover><mi>n</mi></mover>",
                    body(new SuperscriptNode(new AccentNode(AccentKind.OVERBRACE, X), new IdentifierNode("n"))));
        }

        @Test
        @DisplayName("Should style single characters with styled code points")
        void testStyles() {
            assertEquals("<mi>ℝ</mi>", body(new StyleNode(StyleKind.DOUBLE_STRUCK, new IdentifierNode("R"))));
            assertEquals("<mi mathvariant=\"normal\">x</mi>", body(new StyleNode(StyleKind.NORMAL, X)));
            assertEquals("<mstyle mathvariant=\"bold\"><mi>a</mi><mi>b</mi></mstyle>",
                    body(new StyleNode(StyleKind.BOLD, RowNode.of(A, B))));
        }

        @Test
        @DisplayName("Should write color and phantoms")
        void testColorAndPhantom() {
            assertEquals("<mstyle mathcolor=\"red\"><mi>x</mi></mstyle>", body(new ColorNode("red", X)));
            assertEquals("<mpadded height=\"0\" depth=\"0\"><mphantom><mi>x</mi></mphantom></mpadded>",
                    body(new PhantomNode(PhantomKind.HORIZONTAL, X)));
            assertEquals("<mphantom><mi>x</mi></mphantom>", body(new PhantomNode(PhantomKind.FULL, X)));
        }
    }

    // ==================== Delimiters ====================

    @Nested
    @DisplayName("Delimiters")
    class Delimiters {

        @Test
        @DisplayName("Should omit invisible fences")
        void testInvisibleFence() {
            assertEquals("<mrow><mi>x</mi><mo fence=\"true\" form=\"postfix\" stretchy=\"true\">|</mo></mrow>",
                    body(new DelimitedNode("", "|", X, true)));
        }

        @Test
        @DisplayName("Should size big delimiters")
        void testSizedDelimiter() {
            assertEquals("<mo fence=\"true\" form=\"prefix\" stretchy=\"true\" symmetric=\"true\" minsize=\"1.2em\""
                            + " maxsize=\"1.2em\">(</mo>",
                    body(new SizedDelimiterNode("(", 1, OperatorForm.PREFIX)));
            assertEquals("", body(new SizedDelimiterNode("", 4, OperatorForm.INFIX)));
        }
    }

    // ==================== Tables ====================

    @Nested
    @DisplayName("Tables")
    class Tables {

        @Test
        @DisplayName("Should fence a matrix")
        void testMatrix() {
            MatrixNode matrix = new MatrixNode(EnvironmentKind.PMATRIX, List.of(List.of(A, B)));

            assertEquals("<mrow><mo fence=\"true\" form=\"prefix\" stretchy=\"true\">(</mo>"
                            + "<mtable><mtr><mtd><mi>a</mi></mtd><mtd><mi>b</mi></mtd></mtr></mtable>"
                            + "<mo fence=\"true\" form=\"postfix\" stretchy=\"true\">)</mo></mrow>",
                    body(matrix));
        }

        @Test
        @DisplayName("Should left-align cases with a single brace")
        void testCases() {
            String xml = body(new MatrixNode(EnvironmentKind.CASES, List.of(List.of(A, B))));

            assertTrue(xml.startsWith("<mrow><mo fence=\"true\" form=\"prefix\" stretchy=\"true\">{</mo>"
                    + "<mtable columnalign=\"left left\">"));
            assertFalse(xml.contains("form=\"postfix\""));
        }

        @Test
        @DisplayName("Should alternate alignment columns between padding cells")
        void testAlignment() {
            MatrixNode align = new MatrixNode(EnvironmentKind.ALIGNED,
                    List.of(List.of(X, RowNode.of(OperatorNode.of("=", "="), new NumberNode("1")))));

            assertEquals("<mtable columnalign=\"right right left left\" displaystyle=\"true\" style=\"width:100%\">"
                            + "<mtr><mtd style=\"padding:0;width:50%\"></mtd>"
                            + "<mtd class=\"tml-right\"><mi>x</mi></mtd>"
                            + "<mtd class=\"tml-left\"><mo>=</mo><mn>1</mn></mtd>"
                            + "<mtd style=\"padding:0;width:50%\"></mtd></mtr></mtable>",
                    body(align));
        }

        @Test
        @DisplayName("Should center gathered rows")
        void testGather() {
            assertEquals("<mtable columnalign=\"center\" displaystyle=\"true\" style=\"width:100%\">"
                            + "<mtr><mtd class=\"tml-center\"><mi>x</mi></mtd></mtr></mtable>",
                    body(new MatrixNode(EnvironmentKind.GATHER, List.of(List.<AstNode>of(X)))));
        }
    }

    // ==================== Large operators ====================

    @Nested
    @DisplayName("Large operators")
    class LargeOperators {

        @Test
        @DisplayName("Should put summation limits under and over")
        void testSum() {
            BigOperatorNode sum = new BigOperatorNode("sum", "∑", BigOperatorClass.SUMMATION, LimitsMode.AUTO,
                    new NumberNode("0"), new IdentifierNode("n"));

            assertEquals("<munderover><mo largeop=\"true\" movablelimits=\"true\">∑</mo><mn>0</mn><mi>n</mi></munderover>",
                    body(sum));
        }

        @Test
        @DisplayName("Should put integral limits to the side")
        void testIntegral() {
            BigOperatorNode integral = new BigOperatorNode("int", "∫", BigOperatorClass.INTEGRAL, LimitsMode.AUTO,
                    new NumberNode("0"), new NumberNode("1"));

            assertEquals("<msubsup><mo largeop=\"true\" movablelimits=\"false\">∫</mo><mn>0</mn><mn>1</mn></msubsup>",
                    body(integral));
        }

        @Test
        @DisplayName("Should write limit operators as prefix text")
        void testLimit() {
            BigOperatorNode lim = new BigOperatorNode("lim", "lim", BigOperatorClass.LIMIT, LimitsMode.AUTO, X, null);

            assertEquals("<munder><mo movablelimits=\"true\" form=\"prefix\">lim</mo><mi>x</mi></munder>", body(lim));
        }
    }

    // ==================== siunitx ====================

    @Nested
    @DisplayName("Quantities")
    class Quantities {

        @Test
        @DisplayName("Should expand scientific notation")
        void testScientific() {
            assertEquals("<mrow><mn>1.5</mn><mo>×</mo><msup><mn>10</mn><mn>3</mn></msup></mrow>",
                    body(new SINumberNode("1.5e3")));
            assertEquals("<mrow><mo>−</mo><mn>2</mn><mo>×</mo><msup><mn>10</mn><mrow><mo>−</mo><mn>3</mn></mrow></msup></mrow>",
                    body(new SINumberNode("-2e-3")));
            assertEquals("<mrow><mo>−</mo><mn>5</mn></mrow>", body(new SINumberNode("-5")));
            assertEquals("<mn>42</mn>", body(new SINumberNode("42")));
        }

        @Test
        @DisplayName("Should write units with powers and a slash")
        void testUnit() {
            SIUnitNode unit = new SIUnitNode(List.of(SIUnitComponent.of(SIPrefixKind.KILO, SIUnitKind.METER, 1)),
                    List.of(SIUnitComponent.of(SIPrefixKind.NONE, SIUnitKind.SECOND, 2)));

            assertEquals("<mrow><mi>km</mi><mo>/</mo><msup><mi mathvariant=\"normal\">s</mi><mn>2</mn></msup></mrow>",
                    body(unit));
        }

        @Test
        @DisplayName("Should write 1 over an empty numerator")
        void testReciprocal() {
            SIUnitNode unit = new SIUnitNode(List.of(), List.of(SIUnitComponent.of(SIUnitKind.SECOND)));

            assertEquals("<mrow><mn>1</mn><mo>/</mo><mi mathvariant=\"normal\">s</mi></mrow>", body(unit));
        }

        @Test
        @DisplayName("Should separate a value from its unit with a thin space")
        void testValue() {
            SIValueNode value = new SIValueNode("3", new SIUnitNode(List.of(SIUnitComponent.of(SIUnitKind.NEWTON),
                    SIUnitComponent.of(SIUnitKind.METER)), List.of()));

            assertEquals("<mrow><mn>3</mn><mspace width=\"0.1667em\"/><mrow><mi mathvariant=\"normal\">N</mi>"
                            + "<mspace width=\"0.1667em\"/><mi mathvariant=\"normal\">m</mi></mrow></mrow>",
                    body(value));
        }
    }
}

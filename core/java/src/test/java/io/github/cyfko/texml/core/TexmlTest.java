package io.github.cyfko.texml.core;

import io.github.cyfko.texml.core.api.LatexCompiler;
import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.ast.FractionNode;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.spi.MacroRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the {@link Texml} facade.
 */
@DisplayName("Texml Tests")
class TexmlTest {

    @Test
    @DisplayName("Should compile inline by default")
    void testCompile() {
        assertEquals("<math xmlns=\"http://www.w3.org/1998/Math/MathML\" display=\"inline\"><msup><mi>x</mi><mn>2</mn></msup></math>",
                Texml.compile("x^2"));
        assertTrue(Texml.compile("x", MathMLOptions.block()).contains("display=\"block\""));
    }

    @Test
    @DisplayName("Should forget macros between calls")
    void testNoSharedMacros() {
        Texml.compile("\\def\\R{\\mathbb{R}}");

        assertFalse(Texml.compile("\\R").contains("ℝ"));
    }

    @Test
    @DisplayName("Should parse and generate separately")
    void testParseThenGenerate() {
        AstNode ast = Texml.parseToAst("\\frac{1}{2}");

        assertInstanceOf(FractionNode.class, ast);
        assertEquals(Texml.compile("\\frac{1}{2}"), Texml.generate(ast, MathMLOptions.defaults()));
    }

    @Test
    @DisplayName("Should share a registry with a new compiler")
    void testNewCompiler() {
        MacroRegistry registry = new MacroRegistry();
        LatexCompiler compiler = Texml.newCompiler(registry);

        compiler.compile("\\def\\e{\\mathrm{e}}", MathMLOptions.defaults());

        assertTrue(registry.contains("e"));
        assertNotSame(Texml.newCompiler().registry(), Texml.newCompiler().registry());
    }
}

package io.github.cyfko.texml.core.impl;

import io.github.cyfko.texml.core.api.CompileResult;
import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.ast.MatrixNode;
import io.github.cyfko.texml.core.ast.SubSupNode;
import io.github.cyfko.texml.core.config.CachePolicy;
import io.github.cyfko.texml.core.config.CompilerPolicy;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.exception.ErrorKind;
import io.github.cyfko.texml.core.spi.MacroRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link BasicLatexCompiler}.
 */
@DisplayName("BasicLatexCompiler Tests")
class BasicLatexCompilerTest {

    private static final String INLINE = "<math xmlns=\"http://www.w3.org/1998/Math/MathML\" display=\"inline\">";

    private BasicLatexCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new BasicLatexCompiler();
    }

    private String compile(String latex) {
        return compiler.compile(latex, MathMLOptions.defaults());
    }

    // ==================== Scenarios ====================

    @Nested
    @DisplayName("Compilation")
    class Compilation {

        @Test
        @DisplayName("Should compile a simple sum")
        void testSimpleSum() {
            assertEquals(INLINE + "<mrow><mi>a</mi><mo>+</mo><mi>b</mi></mrow></math>", compile("a + b"));
        }

        @Test
        @DisplayName("Should compile a fraction")
        void testFraction() {
            assertEquals(INLINE + "<mfrac><mi>a</mi><mi>b</mi></mfrac></math>", compile("\\frac{a}{b}"));
        }

        @Test
        @DisplayName("Should combine a subscript and a superscript")
        void testScripts() {
            assertTrue(compile("x_i^2").contains("<msubsup><mi>x</mi><mi>i</mi><mn>2</mn></msubsup>"));
        }

        @Test
        @DisplayName("Should write block display")
        void testBlock() {
            String mathml = compiler.compile("x", MathMLOptions.block());

            assertEquals("<math xmlns=\"http://www.w3.org/1998/Math/MathML\" display=\"block\"><mi>x</mi></math>",
                    mathml);
        }

        @Test
        @DisplayName("Should accept unit shorthand and long form alike")
        void testUnits() {
            String shorthand = compile("\\si{km}");

            assertTrue(shorthand.contains("<mi>km</mi>"));
            assertEquals(shorthand, compile("\\si{\\kilo\\meter}"));
        }

        @Test
        @DisplayName("Should fence cases with a left brace only")
        void testCases() {
            String mathml = compile("\\begin{cases} x & x>0 \\\\ -x & x\\le 0 \\end{cases}");

            assertTrue(mathml.contains("<mo fence=\"true\" form=\"prefix\" stretchy=\"true\">{</mo>"
                    + "<mtable columnalign=\"left left\">"));
            assertEquals(2, mathml.split("<mtr>", -1).length - 1);
            assertFalse(mathml.contains("form=\"postfix\""));
        }

        @Test
        @DisplayName("Should expand a macro like its body")
        void testMacro() {
            String expanded = compile("\\def\\R{\\mathbb{R}} x \\in \\R");

            assertTrue(expanded.contains("<mi>ℝ</mi>"));
            assertEquals(new BasicLatexCompiler().compile("x \\in \\mathbb{R}", MathMLOptions.defaults()), expanded);
        }

        @Test
        @DisplayName("Should render unknown commands as identifiers")
        void testUnknownCommand() {
            assertEquals(INLINE + "<mrow><mi>foo</mi><mo>+</mo><mn>1</mn></mrow></math>", compile("\\foo + 1"));
        }

        @Test
        @DisplayName("Should reject empty input")
        void testEmpty() {
            CompileException e = assertThrows(CompileException.class, () -> compile(""));

            assertEquals(ErrorKind.UNEXPECTED_EOF, e.getKind());
            assertEquals("Empty expression", e.getMessage());
        }
    }

    // ==================== Invariants ====================

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @Test
        @DisplayName("Should be deterministic")
        void testDeterminism() {
            String source = "\\sum_{i=1}^{n} \\frac{i^2}{\\sqrt{i}} + \\SI{9.81}{m/s^2}";

            assertEquals(compile(source), compile(source));
            assertEquals(compile(source), new BasicLatexCompiler().compile(source, MathMLOptions.defaults()));
        }

        @Test
        @DisplayName("Should attach scripts independently of their order")
        void testScriptOrder() {
            AstNode subFirst = compiler.parseToAst("x_i^2");
            AstNode supFirst = compiler.parseToAst("x^2_i");

            assertInstanceOf(SubSupNode.class, subFirst);
            assertEquals(subFirst, supFirst);
        }

        @Test
        @DisplayName("Should expand every macro occurrence the same way")
        void testMacroOccurrences() {
            String mathml = compile("\\def\\half{\\frac{1}{2}} \\half + \\half");
            String fraction = "<mfrac><mn>1</mn><mn>2</mn></mfrac>";

            assertEquals(INLINE + "<mrow>" + fraction + "<mo>+</mo>" + fraction + "</mrow></math>", mathml);
        }

        @ParameterizedTest
        @ValueSource(strings = {"{a", "a}", "\\frac{a}{b", "\\left( x", "x \\right)", "{{x}"})
        @DisplayName("Should reject unbalanced groups")
        void testUnbalanced(String source) {
            CompileException e = assertThrows(CompileException.class, () -> compile(source));

            assertTrue(e.getKind() == ErrorKind.MISMATCHED_BRACES || e.getKind() == ErrorKind.UNEXPECTED_EOF,
                    () -> source + " failed with " + e.getKind());
        }

        @Test
        @DisplayName("Should reject mismatched environments")
        void testEnvironmentMismatch() {
            CompileException e = assertThrows(CompileException.class,
                    () -> compile("\\begin{pmatrix} a & b \\end{bmatrix}"));

            assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
            assertEquals("Environment pmatrix ended by \\end{bmatrix}", e.getMessage());
        }

        @Test
        @DisplayName("Should size a matrix from its separators")
        void testMatrixShape() {
            AstNode ast = compiler.parseToAst("\\begin{pmatrix} a & b & c \\\\ d & e & f \\end{pmatrix}");

            MatrixNode matrix = assertInstanceOf(MatrixNode.class, ast);
            assertEquals(2, matrix.rows().size());
            assertEquals(3, matrix.columnCount());
        }
    }

    // ==================== Errors ====================

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Should reject input above the length limit")
        void testLengthLimit() {
            BasicLatexCompiler limited = new BasicLatexCompiler(new MacroRegistry(),
                    CompilerPolicy.builder().maxInputLength(10).build(), CachePolicy.defaults());

            CompileException e = assertThrows(CompileException.class,
                    () -> limited.compile("x".repeat(11), MathMLOptions.defaults()));

            assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
            assertEquals(0, e.getPosition());
            assertEquals("Input exceeds maximum length of 10 chars (got 11)", e.getMessage());
            assertDoesNotThrow(() -> limited.compile("x".repeat(10), MathMLOptions.defaults()));
        }

        @Test
        @DisplayName("Should attach the source around the error")
        void testErrorContext() {
            CompileException e = assertThrows(CompileException.class, () -> compile("abcdefghijklmn } xyz"));

            assertEquals(ErrorKind.MISMATCHED_BRACES, e.getKind());
            assertEquals(15, e.getPosition());
            assertEquals("fghijklmn } xyz", e.getContext());
        }

        @Test
        @DisplayName("Should count positions in chars, not bytes")
        void testPositionUnit() {
            // Given: α takes one char but two UTF-8 bytes
            CompileException e = assertThrows(CompileException.class, () -> compile("α }"));

            assertEquals(ErrorKind.MISMATCHED_BRACES, e.getKind());
            assertEquals(2, e.getPosition());
        }

        @Test
        @DisplayName("Should report failures as a value")
        void testTryCompile() {
            CompileResult failure = compiler.tryCompile("\\frac{a}", MathMLOptions.defaults());
            CompileResult success = compiler.tryCompile("a", MathMLOptions.defaults());

            assertFalse(failure.isSuccess());
            assertNotNull(failure.getError());
            assertTrue(success.isSuccess());
            assertEquals(INLINE + "<mi>a</mi></math>", success.getMathml());
        }

        @Test
        @DisplayName("Should turn stack exhaustion into an internal error")
        void testStackExhaustion() throws InterruptedException {
            BasicLatexCompiler deep = new BasicLatexCompiler(new MacroRegistry(),
                    CompilerPolicy.builder().maxInputLength(100_000).maxNestingDepth(1_000_000).build(),
                    CachePolicy.none());
            String source = "{".repeat(20_000) + "x" + "}".repeat(20_000);
            AtomicReference<Throwable> thrown = new AtomicReference<>();

            Thread thread = new Thread(null, () -> {
                try {
                    deep.compile(source, MathMLOptions.defaults());
                } catch (Throwable t) {
                    thrown.set(t);
                }
            }, "small-stack", 128 * 1024);
            thread.start();
            thread.join();

            CompileException e = assertInstanceOf(CompileException.class, thrown.get());
            assertEquals(ErrorKind.INTERNAL_ERROR, e.getKind());
        }
    }

    // ==================== Macros and cache ====================

    @Nested
    @DisplayName("Macros and cache")
    class MacrosAndCache {

        @Test
        @DisplayName("Should keep definitions for later fragments")
        void testPreamble() {
            compile("\\newcommand{\\norm}[1]{\\left\\| #1 \\right\\|}");

            assertTrue(compiler.registry().contains("norm"));
            assertEquals(compile("\\left\\| v \\right\\|"), compile("\\norm{v}"));
        }

        @Test
        @DisplayName("Should not share definitions between compilers")
        void testIsolation() {
            compile("\\def\\R{\\mathbb{R}}");

            // unknown there, so rendered as a plain identifier
            assertEquals(INLINE + "<mi>R</mi></math>",
                    new BasicLatexCompiler().compile("\\R", MathMLOptions.defaults()));
        }

        @Test
        @DisplayName("Should serve repeated fragments from the cache")
        void testCacheHit() {
            String first = compile("x^2");
            String second = compile("x^2");

            assertSame(first, second);
            assertEquals(Map.of("enabled", true, "size", 1, "maxSize", 512), compiler.getCacheStats());
        }

        @Test
        @DisplayName("Should not cache fragments defining macros")
        void testDefinitionsNotCached() {
            compile("\\def\\R{\\mathbb{R}}");

            assertEquals(0, compiler.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("Should recompile after a redefinition")
        void testCacheInvalidation() {
            compile("\\def\\R{\\mathbb{R}}");
            String before = compile("\\R");

            compile("\\renewcommand{\\R}{\\mathbf{R}}");
            String after = compile("\\R");

            assertTrue(before.contains("<mi>ℝ</mi>"));
            assertTrue(after.contains("<mi>𝐑</mi>"));
        }

        @Test
        @DisplayName("Should report a disabled cache")
        void testNoCache() {
            BasicLatexCompiler uncached = new BasicLatexCompiler(new MacroRegistry(), CompilerPolicy.defaults(),
                    CachePolicy.none());

            uncached.compile("x", MathMLOptions.defaults());

            assertEquals(Map.of("enabled", false), uncached.getCacheStats());
        }

        @Test
        @DisplayName("Should empty the cache on demand")
        void testClearCache() {
            compile("x");
            compiler.clearCache();

            assertEquals(0, compiler.getCacheStats().get("size"));
        }
    }
}

package io.github.cyfko.texml.core.api;

import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.spi.MacroRegistry;

/**
 * Compiles LaTeX math fragments to Presentation MathML.
 * <p>
 * The pipeline is {@code source → Lexer → tokens → Parser → AST → MathMLGenerator → MathML}.
 * It is synchronous and fail-fast: the first problem aborts the compilation with a
 * {@link CompileException} and no partial output.
 * </p>
 *
 * <h2>Supported Input</h2>
 * <ul>
 *   <li>numbers, identifiers, operators, Greek letters and symbols</li>
 *   <li>scripts, fractions, binomials, roots, accents, fonts, colors, spacing</li>
 *   <li>{@code \left...\right}, sized delimiters, large operators with limits</li>
 *   <li>matrix, cases and alignment environments</li>
 *   <li>macros defined with {@code \def}, {@code \newcommand}, {@code \renewcommand}, {@code \providecommand}</li>
 *   <li>siunitx: {@code \num}, {@code \si}/<code>&#92;unit</code>, {@code \SI}/{@code \qty}</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * LatexCompiler compiler = new BasicLatexCompiler();
 *
 * compiler.compile("\\frac{1}{2}", MathMLOptions.defaults());
 * // <math xmlns="http://www.w3.org/1998/Math/MathML" display="inline"><mfrac><mn>1</mn><mn>2</mn></mfrac></math>
 *
 * CompileResult result = compiler.tryCompile("{a", MathMLOptions.block());
 * if (!result.isSuccess()) {
 *     System.err.print(result.getError().formatError("{a"));
 * }
 * }</pre>
 *
 * <h2>Macros</h2>
 * <p>
 * Each compiler owns a {@link MacroRegistry}. Definitions made by one fragment are visible to
 * the next fragments compiled with the same compiler, like a document preamble. Unrelated
 * documents must not share a compiler.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface LatexCompiler {

    /**
     * Compiles a fragment.
     *
     * @param latex   LaTeX math source, without {@code $} delimiters
     * @param options output options
     * @return a complete {@code <math>} element
     * @throws CompileException if the source is malformed or exceeds the compiler's policy
     */
    String compile(String latex, MathMLOptions options);

    /**
     * Same as {@link #compile(String, MathMLOptions)} but reports failures as a value.
     *
     * @param latex   LaTeX math source
     * @param options output options
     * @return the MathML or the compile error
     */
    CompileResult tryCompile(String latex, MathMLOptions options);

    /**
     * Runs the lexer and the parser only.
     *
     * @param latex LaTeX math source
     * @return the root of the syntax tree
     * @throws CompileException if the source is malformed
     */
    AstNode parseToAst(String latex);

    /**
     * Serializes a tree produced by {@link #parseToAst(String)}, or built by hand.
     *
     * @param ast     the tree
     * @param options output options
     * @return a complete {@code <math>} element
     */
    String generate(AstNode ast, MathMLOptions options);

    /**
     * @return the macros visible to this compiler
     */
    MacroRegistry registry();
}

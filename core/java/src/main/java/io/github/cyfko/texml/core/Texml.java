package io.github.cyfko.texml.core;

import io.github.cyfko.texml.core.api.LatexCompiler;
import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.config.CachePolicy;
import io.github.cyfko.texml.core.config.CompilerPolicy;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.impl.BasicLatexCompiler;
import io.github.cyfko.texml.core.spi.MacroRegistry;

/**
 * Static entry points for one-off compilations.
 * <p>
 * Every call uses a fresh {@link MacroRegistry}: macros defined by one call are not visible to
 * the next. Keep a {@link LatexCompiler} from {@link #newCompiler()} to compile a document
 * whose fragments share a preamble.
 * </p>
 *
 * <pre>{@code
 * Texml.compile("x^2");
 * // <math xmlns="http://www.w3.org/1998/Math/MathML" display="inline"><msup><mi>x</mi><mn>2</mn></msup></math>
 *
 * Texml.compile("\\sum_{i=1}^n i", MathMLOptions.block());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Texml {

    public static final String VERSION = "1.0.0";

    private Texml() {
        // static facade
    }

    /**
     * Compiles inline math with the default policy.
     */
    public static String compile(String latex) {
        return compile(latex, MathMLOptions.defaults());
    }

    public static String compile(String latex, MathMLOptions options) {
        return oneShot().compile(latex, options);
    }

    public static AstNode parseToAst(String latex) {
        return oneShot().parseToAst(latex);
    }

    public static String generate(AstNode ast, MathMLOptions options) {
        return oneShot().generate(ast, options);
    }

    /**
     * @return a compiler with its own registry and the default policies
     */
    public static LatexCompiler newCompiler() {
        return new BasicLatexCompiler();
    }

    /**
     * @param registry macros to share with the new compiler
     */
    public static LatexCompiler newCompiler(MacroRegistry registry) {
        return new BasicLatexCompiler(registry);
    }

    private static LatexCompiler oneShot() {
        return new BasicLatexCompiler(new MacroRegistry(), CompilerPolicy.defaults(), CachePolicy.none());
    }
}

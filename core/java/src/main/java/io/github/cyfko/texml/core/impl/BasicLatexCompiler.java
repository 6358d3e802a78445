package io.github.cyfko.texml.core.impl;

import io.github.cyfko.texml.core.api.CompileResult;
import io.github.cyfko.texml.core.api.LatexCompiler;
import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.cache.CompilationCache;
import io.github.cyfko.texml.core.config.CachePolicy;
import io.github.cyfko.texml.core.config.CompilerPolicy;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.exception.ErrorKind;
import io.github.cyfko.texml.core.generator.MathMLGenerator;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.model.TokenKind;
import io.github.cyfko.texml.core.parsing.CommandCategory;
import io.github.cyfko.texml.core.parsing.CommandInfo;
import io.github.cyfko.texml.core.parsing.CommandTable;
import io.github.cyfko.texml.core.parsing.Lexer;
import io.github.cyfko.texml.core.parsing.Parser;
import io.github.cyfko.texml.core.spi.MacroRegistry;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Default {@link LatexCompiler}: lexer, parser and MathML generator wired together, with
 * resource limits from a {@link CompilerPolicy} and optional memoisation.
 *
 * <h2>Resource Limits</h2>
 * <ul>
 *   <li><strong>Input Length</strong>: longer sources fail with {@code InvalidArgument} at position 0</li>
 *   <li><strong>Expansion Depth</strong>: enforced by the parser</li>
 *   <li><strong>Nesting Depth</strong>: enforced by the parser</li>
 * </ul>
 *
 * <h2>Caching</h2>
 * <ul>
 *   <li><strong>Cache Level</strong>: {@link #compile(String, MathMLOptions)} output</li>
 *   <li><strong>Cache Key</strong>: source, options and {@link MacroRegistry#version()}</li>
 *   <li><strong>Not Cached</strong>: sources defining macros, since a hit would skip the definition</li>
 *   <li><strong>Configurable</strong>: enable/disable via {@link CachePolicy}</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Defaults: 20000 chars, fresh registry, 512 cached fragments
 * LatexCompiler compiler = new BasicLatexCompiler();
 *
 * // Public endpoint
 * LatexCompiler strict = new BasicLatexCompiler(new MacroRegistry(), CompilerPolicy.strict(), CachePolicy.strict());
 * }</pre>
 *
 * <p>Not thread-safe when compiled sources define macros: give each document its own compiler.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicLatexCompiler implements LatexCompiler {
    private static final Logger LOGGER = Logger.getLogger(BasicLatexCompiler.class.getName());

    /** Chars of source kept on each side of the error position. */
    static final int CONTEXT_RADIUS = 10;

    private final MacroRegistry registry;
    private final CompilerPolicy compilerPolicy;
    private final CachePolicy cachePolicy;
    private final Lexer lexer;
    private final MathMLGenerator generator = new MathMLGenerator();
    protected final CompilationCache cache;

    /**
     * Fresh registry, {@link CompilerPolicy#defaults()}, {@link CachePolicy#defaults()}.
     */
    public BasicLatexCompiler() {
        this(new MacroRegistry());
    }

    /**
     * @param registry macros shared with the caller
     */
    public BasicLatexCompiler(MacroRegistry registry) {
        this(registry, CompilerPolicy.defaults(), CachePolicy.defaults());
    }

    public BasicLatexCompiler(MacroRegistry registry, CompilerPolicy compilerPolicy, CachePolicy cachePolicy) {
        this(registry, compilerPolicy, cachePolicy, Lexer.standard());
    }

    /**
     * @param registry       macros shared with the caller
     * @param compilerPolicy resource limits
     * @param cachePolicy    memoisation settings
     * @param lexer          lexer, e.g. one built on a custom Unicode table
     */
    public BasicLatexCompiler(MacroRegistry registry, CompilerPolicy compilerPolicy, CachePolicy cachePolicy,
                              Lexer lexer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.compilerPolicy = Objects.requireNonNull(compilerPolicy, "compilerPolicy");
        this.cachePolicy = Objects.requireNonNull(cachePolicy, "cachePolicy");
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.cache = cachePolicy.cacheEnabled() ? new CompilationCache(cachePolicy.cacheSize()) : null;
    }

    @Override
    public String compile(String latex, MathMLOptions options) {
        Objects.requireNonNull(latex, "latex");
        Objects.requireNonNull(options, "options");
        long start = System.nanoTime();

        CompilationCache.Key key = null;
        if (cache != null) {
            key = new CompilationCache.Key(latex, options, registry.version());
            String cached = cache.get(key).orElse(null);
            if (cached != null) {
                LOGGER.fine(() -> "Cache hit for: " + abbreviate(latex));
                return cached;
            }
        }

        try {
            checkLength(latex);
            List<Token> tokens = lexer.lex(latex);
            AstNode ast = parse(tokens);
            String mathml = generator.generate(ast, options);

            if (key != null && key.registryVersion() == registry.version() && !definesMacros(tokens)) {
                cache.put(key, mathml);
            }
            LOGGER.fine(() -> String.format("Compiled %d chars in %d µs (policy %s)", latex.length(),
                    TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start), compilerPolicy.policyName()));
            return mathml;
        } catch (CompileException e) {
            throw withSourceContext(e, latex);
        }
    }

    @Override
    public CompileResult tryCompile(String latex, MathMLOptions options) {
        try {
            return CompileResult.success(compile(latex, options));
        } catch (CompileException e) {
            return CompileResult.failure(e);
        }
    }

    @Override
    public AstNode parseToAst(String latex) {
        Objects.requireNonNull(latex, "latex");
        try {
            checkLength(latex);
            return parse(lexer.lex(latex));
        } catch (CompileException e) {
            throw withSourceContext(e, latex);
        }
    }

    @Override
    public String generate(AstNode ast, MathMLOptions options) {
        return generator.generate(ast, options);
    }

    @Override
    public MacroRegistry registry() {
        return registry;
    }

    public CompilerPolicy getCompilerPolicy() {
        return compilerPolicy;
    }

    public CachePolicy getCachePolicy() {
        return cachePolicy;
    }

    /**
     * Clears the output cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * @return cache statistics, or {@code enabled=false} if caching is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }
        return Map.of(
                "enabled", true,
                "size", cache.size(),
                "maxSize", cache.getMaxSize()
        );
    }

    private void checkLength(String latex) {
        if (latex.length() > compilerPolicy.maxInputLength()) {
            throw CompileException.invalidArgument(
                    "Input exceeds maximum length of " + compilerPolicy.maxInputLength() + " chars (got "
                            + latex.length() + ")", 0);
        }
    }

    private AstNode parse(List<Token> tokens) {
        try {
            return new Parser(tokens, registry, compilerPolicy).parse();
        } catch (StackOverflowError e) {
            // nesting limits set above what the thread stack can hold
            throw new CompileException(ErrorKind.INTERNAL_ERROR,
                    "Expression too deeply nested for the available stack", 0);
        }
    }

    private static boolean definesMacros(List<Token> tokens) {
        CommandTable commands = CommandTable.standard();
        for (Token token : tokens) {
            if (token.is(TokenKind.COMMAND)
                    && commands.lookup(token.value()).map(CommandInfo::category)
                    .filter(category -> category == CommandCategory.MACRO_DEFINITION).isPresent()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Attaches the source excerpt around the error position, unless already present.
     */
    static CompileException withSourceContext(CompileException e, String source) {
        if (!e.getContext().isEmpty() || e.getPosition() < 0 || source.isEmpty()) {
            return e;
        }
        int position = Math.min(e.getPosition(), source.length());
        int from = Math.max(0, position - CONTEXT_RADIUS);
        int to = Math.min(source.length(), position + CONTEXT_RADIUS);
        return e.withContext(source.substring(from, to));
    }

    private static String abbreviate(String latex) {
        return latex.length() <= 40 ? latex : latex.substring(0, 40) + "...";
    }
}

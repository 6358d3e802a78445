package io.github.cyfko.texml.spring.service.impl;

import io.github.cyfko.texml.core.api.CompileResult;
import io.github.cyfko.texml.core.cache.CompilationCache;
import io.github.cyfko.texml.core.config.CachePolicy;
import io.github.cyfko.texml.core.config.CompilerPolicy;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.impl.BasicLatexCompiler;
import io.github.cyfko.texml.core.spi.MacroRegistry;
import io.github.cyfko.texml.spring.service.TexmlService;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Compiles each request against a private copy of the preamble, sharing one output cache.
 * <p>
 * An output is cached only when the request defined no macro: its registry copy is then still
 * at version 0.
 * </p>
 */
public class TexmlServiceImpl implements TexmlService {
    private static final Logger LOGGER = Logger.getLogger(TexmlServiceImpl.class.getName());

    private final MacroRegistry preamble;
    private final CompilerPolicy compilerPolicy;
    private final MathMLOptions defaultOptions;
    private final CompilationCache cache;

    /**
     * @param preamble       macros visible to every request
     * @param compilerPolicy resource limits
     * @param cacheSize      shared cache capacity, 0 for none
     * @param defaultOptions options of {@link #compile(String)}
     */
    public TexmlServiceImpl(MacroRegistry preamble, CompilerPolicy compilerPolicy, int cacheSize,
                            MathMLOptions defaultOptions) {
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must not be negative, got: " + cacheSize);
        }
        this.preamble = Objects.requireNonNull(preamble, "preamble");
        this.compilerPolicy = Objects.requireNonNull(compilerPolicy, "compilerPolicy");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
        this.cache = cacheSize > 0 ? new CompilationCache(cacheSize) : null;
    }

    @Override
    public String compile(String latex) {
        return compile(latex, defaultOptions);
    }

    @Override
    public String compile(String latex, MathMLOptions options) {
        Objects.requireNonNull(latex, "latex");
        Objects.requireNonNull(options, "options");

        CompilationCache.Key key = cache == null ? null : new CompilationCache.Key(latex, options, preamble.version());
        if (key != null) {
            String cached = cache.get(key).orElse(null);
            if (cached != null) {
                return cached;
            }
        }

        MacroRegistry requestRegistry = preamble.copy();
        String mathml = new BasicLatexCompiler(requestRegistry, compilerPolicy, CachePolicy.none()).compile(latex, options);
        if (key != null && requestRegistry.version() == 0) {
            cache.put(key, mathml);
        } else if (key != null) {
            LOGGER.fine(() -> "Not caching a request that defines macros");
        }
        return mathml;
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
    public MathMLOptions defaultOptions() {
        return defaultOptions;
    }

    @Override
    public MacroRegistry preamble() {
        return preamble.copy();
    }
}

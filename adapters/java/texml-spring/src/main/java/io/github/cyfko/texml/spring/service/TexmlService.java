package io.github.cyfko.texml.spring.service;

import io.github.cyfko.texml.core.api.CompileResult;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.spi.MacroRegistry;

/**
 * Compiles LaTeX math in a Spring application.
 * <p>
 * Every call sees the configured preamble macros. Macros a request defines stay local to
 * that request, so the service is safe to call concurrently.
 * </p>
 *
 * <h2>Usage Context</h2>
 * <ul>
 *   <li>Injectable bean for controllers, template helpers and batch jobs</li>
 *   <li>Backs the {@code POST {texml.endpoint.path}/compile} endpoint</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TexmlService {

    /**
     * Compiles with the configured default display style.
     *
     * @throws io.github.cyfko.texml.core.exception.CompileException on malformed input
     */
    String compile(String latex);

    /**
     * @throws io.github.cyfko.texml.core.exception.CompileException on malformed input
     */
    String compile(String latex, MathMLOptions options);

    CompileResult tryCompile(String latex, MathMLOptions options);

    /**
     * @return the options used when a caller gives none
     */
    MathMLOptions defaultOptions();

    /**
     * @return a copy of the preamble macros
     */
    MacroRegistry preamble();
}

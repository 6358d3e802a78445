package io.github.cyfko.texml.core.api;

import io.github.cyfko.texml.core.exception.CompileException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link LatexCompiler#tryCompile}: either the MathML output or the error that
 * stopped the compilation.
 * <p>
 * Instances are immutable and created via {@link #success(String)} and
 * {@link #failure(CompileException)}.
 * </p>
 *
 * <pre>{@code
 * CompileResult result = compiler.tryCompile(latex, MathMLOptions.defaults());
 * String html = result.isSuccess()
 *         ? result.getMathml()
 *         : "<pre>" + result.getError().formatError(latex) + "</pre>";
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CompileResult {

    private final String mathml;
    private final CompileException error;

    private CompileResult(String mathml, CompileException error) {
        this.mathml = mathml;
        this.error = error;
    }

    public static CompileResult success(String mathml) {
        return new CompileResult(Objects.requireNonNull(mathml, "mathml"), null);
    }

    public static CompileResult failure(CompileException error) {
        return new CompileResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the MathML output, or null if the compilation failed
     */
    public String getMathml() {
        return mathml;
    }

    /**
     * @return the error, or null if the compilation succeeded
     */
    public CompileException getError() {
        return error;
    }

    public Optional<String> mathml() {
        return Optional.ofNullable(mathml);
    }

    /**
     * @return the MathML output
     * @throws CompileException the stored error if the compilation failed
     */
    public String getOrThrow() {
        if (error != null) {
            throw error;
        }
        return mathml;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CompileResult[success=true]"
                : "CompileResult[success=false, error=" + error.getKind().label() + ": " + error.getMessage() + "]";
    }
}

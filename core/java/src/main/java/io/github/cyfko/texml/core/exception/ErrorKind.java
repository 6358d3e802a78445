package io.github.cyfko.texml.core.exception;

/**
 * Closed set of failure categories reported by the compilation pipeline.
 * <p>
 * Each kind carries the label used when rendering an error for humans
 * (see {@link CompileException#formatError(String)}).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ErrorKind {
    UNEXPECTED_TOKEN("UnexpectedToken"),
    UNEXPECTED_EOF("UnexpectedEof"),
    INVALID_COMMAND("InvalidCommand"),
    MISMATCHED_BRACES("MismatchedBraces"),
    INVALID_ARGUMENT("InvalidArgument"),
    MISSING_ARGUMENT("MissingArgument"),
    INVALID_NUMBER("InvalidNumber"),
    INTERNAL_ERROR("InternalError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    /**
     * @return the display label of this kind, e.g. {@code UnexpectedToken}
     */
    public String label() {
        return label;
    }
}

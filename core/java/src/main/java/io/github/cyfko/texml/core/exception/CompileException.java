package io.github.cyfko.texml.core.exception;

import io.github.cyfko.texml.core.api.LatexCompiler;

import java.util.Objects;

/**
 * Exception thrown when a LaTeX fragment cannot be compiled to MathML.
 * <p>
 * The pipeline is fail-fast: the first problem found by the lexer or the parser aborts the
 * whole compilation with a single {@code CompileException}. No partial output is produced.
 * </p>
 *
 * <p>Every instance carries:</p>
 * <ul>
 *   <li><strong>kind</strong>: the {@link ErrorKind} category</li>
 *   <li><strong>message</strong>: a short human readable description</li>
 *   <li><strong>position</strong>: the char offset in the source where the problem was detected</li>
 *   <li><strong>context</strong>: an optional excerpt of the source around the position</li>
 * </ul>
 *
 * <p><strong>Error Examples:</strong></p>
 * <pre>{@code
 * compiler.compile("a $ b", MathMLOptions.defaults());
 * // → UnexpectedToken: Unexpected character: $
 *
 * compiler.compile("{a", MathMLOptions.defaults());
 * // → UnexpectedEof: Unexpected end of input
 *
 * compiler.compile("\\begin{pmatrix} a \\end{bmatrix}", MathMLOptions.defaults());
 * // → InvalidArgument: Environment pmatrix ended by \end{bmatrix}
 * }</pre>
 *
 * <p><strong>Rendering for users:</strong></p>
 * <pre>{@code
 * try {
 *     return compiler.compile(latex, options);
 * } catch (CompileException e) {
 *     System.err.print(e.formatError(latex));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see LatexCompiler
 */
public class CompileException extends RuntimeException {

    private final ErrorKind kind;
    private final int position;
    private final String context;

    /**
     * Creates an exception without context.
     *
     * @param kind     category of the failure
     * @param message  description of the failure
     * @param position char offset of the failure in the source, or {@code -1} if unknown
     */
    public CompileException(ErrorKind kind, String message, int position) {
        this(kind, message, position, "");
    }

    /**
     * Creates an exception with a source excerpt.
     *
     * @param kind     category of the failure
     * @param message  description of the failure
     * @param position char offset of the failure in the source, or {@code -1} if unknown
     * @param context  source excerpt around the position, may be empty
     */
    public CompileException(ErrorKind kind, String message, int position, String context) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.position = position;
        this.context = context == null ? "" : context;
    }

    public static CompileException unexpectedToken(String token, int position) {
        return new CompileException(ErrorKind.UNEXPECTED_TOKEN, "Unexpected token: " + token, position);
    }

    public static CompileException unexpectedCharacter(String character, int position) {
        return new CompileException(ErrorKind.UNEXPECTED_TOKEN, "Unexpected character: " + character, position);
    }

    public static CompileException unexpectedEof(int position) {
        return new CompileException(ErrorKind.UNEXPECTED_EOF, "Unexpected end of input", position);
    }

    public static CompileException invalidCommand(String command, int position) {
        return new CompileException(ErrorKind.INVALID_COMMAND, "Invalid command: " + command, position);
    }

    public static CompileException mismatchedBraces(int position) {
        return new CompileException(ErrorKind.MISMATCHED_BRACES, "Mismatched braces", position);
    }

    public static CompileException missingArgument(String command, int position) {
        return new CompileException(ErrorKind.MISSING_ARGUMENT, "Missing argument for command: " + command, position);
    }

    public static CompileException invalidArgument(String message, int position) {
        return new CompileException(ErrorKind.INVALID_ARGUMENT, message, position);
    }

    public static CompileException invalidNumber(String message, int position) {
        return new CompileException(ErrorKind.INVALID_NUMBER, message, position);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return offset of the failure in UTF-16 chars (a {@link String} index, not a byte offset), or -1
     */
    public int getPosition() {
        return position;
    }

    public String getContext() {
        return context;
    }

    /**
     * Returns a copy of this exception carrying the given source excerpt.
     * The stack trace of the original failure is preserved.
     *
     * @param context source excerpt around {@link #getPosition()}
     * @return a new exception with the same kind, message and position
     */
    public CompileException withContext(String context) {
        CompileException copy = new CompileException(kind, getMessage(), position, context);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    /**
     * Renders this error against the source it was raised for.
     * <p>
     * The first line is {@code <Kind>: <message>}. When the position falls inside the source,
     * the offending line follows, indented by two spaces, then a caret under the column:
     * </p>
     * <pre>
     * UnexpectedToken: Unexpected character: $
     *   a $ b
     *     ^
     * </pre>
     *
     * @param source the compiled source
     * @return the multi-line rendering, always terminated by a line feed
     */
    public String formatError(String source) {
        StringBuilder out = new StringBuilder();
        out.append(kind.label()).append(": ").append(getMessage()).append('\n');

        if (source != null && position >= 0 && position < source.length()) {
            int lineStart = position;
            while (lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
                lineStart--;
            }
            int lineEnd = position;
            while (lineEnd < source.length() && source.charAt(lineEnd) != '\n') {
                lineEnd++;
            }
            int column = position - lineStart;
            out.append("  ").append(source, lineStart, lineEnd).append('\n');
            out.append("  ").append(" ".repeat(column)).append("^\n");
        }
        return out.toString();
    }

    @Override
    public String toString() {
        String text = kind.label() + " at position " + position + ": " + getMessage();
        return context.isEmpty() ? text : text + "\nContext: " + context;
    }
}

package io.github.cyfko.texml.core.config;

/**
 * Output options of the MathML generator.
 * <p>
 * {@code displayStyle} selects {@code display="block"} instead of {@code display="inline"} on
 * the root {@code <math>} element; the attribute is always written. {@code prettyPrint} and
 * {@code indentSize} are reserved: they are accepted and carried along but the generator
 * currently always writes compact output.
 * </p>
 *
 * <pre>{@code
 * MathMLOptions.defaults();   // inline
 * MathMLOptions.block();      // display="block"
 * MathMLOptions.builder().displayStyle(true).build();
 * }</pre>
 *
 * @param displayStyle block (true) or inline (false) math
 * @param prettyPrint  reserved
 * @param indentSize   reserved, must not be negative
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MathMLOptions(
        boolean displayStyle,
        boolean prettyPrint,
        int indentSize
) {

    public MathMLOptions {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative, got: " + indentSize);
        }
    }

    /**
     * @return inline math, compact output, indent 2
     */
    public static MathMLOptions defaults() {
        return new MathMLOptions(false, false, 2);
    }

    /**
     * Same as {@link #defaults()}.
     */
    public static MathMLOptions inline() {
        return defaults();
    }

    /**
     * @return block math, compact output, indent 2
     */
    public static MathMLOptions block() {
        return new MathMLOptions(true, false, 2);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean _displayStyle = false;
        private boolean _prettyPrint = false;
        private int _indentSize = 2;

        private Builder() {}

        public MathMLOptions build() {
            return new MathMLOptions(_displayStyle, _prettyPrint, _indentSize);
        }

        public Builder displayStyle(boolean displayStyle) { this._displayStyle = displayStyle; return this; }
        public Builder prettyPrint(boolean prettyPrint) { this._prettyPrint = prettyPrint; return this; }
        public Builder indentSize(int indentSize) { this._indentSize = indentSize; return this; }
    }
}

package io.github.cyfko.texml.core.generator;

/**
 * Minimal XML writer used by the generator. Attributes are passed as alternating name/value
 * strings; a {@code null} value skips the attribute.
 */
final class MarkupWriter {

    private final StringBuilder out = new StringBuilder(256);

    MarkupWriter open(String element, String... attributes) {
        out.append('<').append(element);
        writeAttributes(attributes);
        out.append('>');
        return this;
    }

    MarkupWriter close(String element) {
        out.append("</").append(element).append('>');
        return this;
    }

    MarkupWriter empty(String element, String... attributes) {
        out.append('<').append(element);
        writeAttributes(attributes);
        out.append("/>");
        return this;
    }

    /**
     * Writes {@code <element attributes>text</element>}.
     */
    MarkupWriter leaf(String element, String text, String... attributes) {
        open(element, attributes);
        text(text);
        return close(element);
    }

    MarkupWriter text(String text) {
        escape(text);
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }

    private void writeAttributes(String... attributes) {
        if (attributes.length % 2 != 0) {
            throw new IllegalArgumentException("Attributes must come in name/value pairs");
        }
        for (int i = 0; i < attributes.length; i += 2) {
            if (attributes[i + 1] == null) {
                continue;
            }
            out.append(' ').append(attributes[i]).append("=\"");
            escape(attributes[i + 1]);
            out.append('"');
        }
    }

    private void escape(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> out.append(c);
            }
        }
    }
}

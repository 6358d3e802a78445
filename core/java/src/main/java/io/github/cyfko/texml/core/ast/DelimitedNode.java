package io.github.cyfko.texml.core.ast;

import java.util.Objects;

/**
 * Content between a pair of delimiters.
 * <p>
 * The two delimiters are independent ({@code \left[ \right)} is legal). An empty string
 * stands for the invisible delimiter {@code .}. {@code stretchy} is true for
 * {@code \left}/{@code \right} pairs and false for brackets typed directly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record DelimitedNode(String open, String close, AstNode content, boolean stretchy) implements AstNode {

    public DelimitedNode {
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(close, "close");
        Objects.requireNonNull(content, "content");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDelimited(this);
    }
}

package io.formulainline.core.model;

import java.util.Objects;

/** Explicit parentheses around an expression, kept as their own node even when redundant. */
public record ParenthesizedExpression(Node inner) implements Node {

    public ParenthesizedExpression {
        Objects.requireNonNull(inner, "inner must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParenthesized(this);
    }
}

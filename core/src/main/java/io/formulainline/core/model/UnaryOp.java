package io.formulainline.core.model;

import java.util.Objects;

/** Prefix {@code +} or {@code -}. {@code --A1} is a chain of two nodes over {@code A1}. */
public record UnaryOp(Operator op, Node operand) implements Node {

    public UnaryOp {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
        if (!op.isUnary()) {
            throw new IllegalArgumentException("not a prefix operator: " + op.symbol());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}

package io.formulainline.core.model;

import java.util.Objects;

/** Infix operation. Chains associate left to right at a single precedence level. */
public record BinaryOp(Operator op, Node left, Node right) implements Node {

    public BinaryOp {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}

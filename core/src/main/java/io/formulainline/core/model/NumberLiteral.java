package io.formulainline.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/** Integer or floating point literal. Keeps the source spelling so {@code 1.50} renders as written. */
public record NumberLiteral(String text) implements Node {

    public NumberLiteral {
        Objects.requireNonNull(text, "text must not be null");
    }

    /** Numeric value of the literal. */
    public BigDecimal value() {
        return new BigDecimal(text);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}

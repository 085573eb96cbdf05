package io.formulainline.core.model;

import java.util.List;
import java.util.Objects;

/** Array literal {@code {1, 2; 3, 4}}: rows separated by {@code ;}, columns by {@code ,}. */
public record ArrayLiteral(List<List<Node>> rows) implements Node {

    public ArrayLiteral {
        Objects.requireNonNull(rows, "rows must not be null");
        if (rows.isEmpty() || rows.stream().anyMatch(List::isEmpty)) {
            throw new IllegalArgumentException("array literal must contain at least one element per row");
        }
        rows = rows.stream().map(List::copyOf).toList();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}

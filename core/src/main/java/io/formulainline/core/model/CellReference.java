package io.formulainline.core.model;

import java.util.Objects;

/** Single cell reference such as {@code A1} or {@code $B$2}, kept verbatim. */
public record CellReference(String text) implements Node {

    public CellReference {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCell(this);
    }
}

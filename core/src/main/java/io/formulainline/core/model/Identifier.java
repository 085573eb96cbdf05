package io.formulainline.core.model;

import java.util.Objects;

/** A bare name: a parameter, a {@code LET}/{@code LAMBDA} binding, a named range or a boolean. */
public record Identifier(String name) implements Node {

    public Identifier {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}

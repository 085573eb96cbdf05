package io.formulainline.core.model;

import java.util.Objects;

/**
 * One declared parameter of a catalog formula.
 *
 * @param name        identifier used in the formula body
 * @param description human-readable description
 * @param example     example argument text, or {@code null} if none is given
 */
public record Parameter(String name, String description, String example) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("parameter name must not be blank");
        }
    }

    public static Parameter named(String name) {
        return new Parameter(name, "", null);
    }
}

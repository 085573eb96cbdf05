package io.formulainline.core.model;

import java.util.Objects;

/**
 * Range reference such as {@code A1:B10}, {@code $A:$A} or {@code 2:2}. Treated as an opaque token;
 * the text is never decomposed beyond its two sides.
 */
public record RangeReference(String text) implements Node {

    public RangeReference {
        Objects.requireNonNull(text, "text must not be null");
        if (text.indexOf(':') < 0) {
            throw new IllegalArgumentException("range reference must contain ':', got: " + text);
        }
    }

    /** Text left of the colon. */
    public String start() {
        return text.substring(0, text.indexOf(':'));
    }

    /** Text right of the colon. */
    public String end() {
        return text.substring(text.indexOf(':') + 1);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRange(this);
    }
}

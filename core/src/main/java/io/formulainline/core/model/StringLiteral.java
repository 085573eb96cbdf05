package io.formulainline.core.model;

import java.util.Objects;

/**
 * Quoted string. {@code content} is fully unescaped; {@code quote} and {@code escaping} record the
 * convention the source used so the literal can be written back the same way.
 */
public record StringLiteral(String content, char quote, Escaping escaping) implements Node {

    public StringLiteral {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(escaping, "escaping must not be null");
        if (quote != '"' && quote != '\'') {
            throw new IllegalArgumentException("quote must be ' or \", got: " + quote);
        }
    }

    /** A double-quoted literal using doubled-quote escaping. */
    public static StringLiteral of(String content) {
        return new StringLiteral(content, '"', Escaping.DOUBLED);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}

package io.formulainline.core.model;

/** An omitted argument slot, e.g. each slot of {@code IF(,,)}. */
public record EmptyArgument() implements Node {

    /** Shared instance; the node carries no state. */
    public static final EmptyArgument INSTANCE = new EmptyArgument();

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitEmptyArgument(this);
    }
}

package io.formulainline.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Call of a named function, built-in or catalog formula.
 *
 * @param name  function name as written
 * @param args  argument nodes; {@link EmptyArgument} marks an omitted slot, an empty list means
 *              {@code NAME()}
 * @param depth number of calls enclosing this one (0 at the parse root)
 * @param span  exact source range from the first character of the name to the closing parenthesis
 */
public record FunctionCall(String name, List<Node> args, int depth, Span span) implements Node {

    public FunctionCall {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(span, "span must not be null");
        args = List.copyOf(args);
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative");
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}

package io.formulainline.core.model;

import java.util.Arrays;
import java.util.Optional;

/** The fixed operator set of the formula language. */
public enum Operator {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    POWER("^"),
    CONCAT("&"),
    EQUAL("="),
    NOT_EQUAL("<>"),
    LESS("<"),
    GREATER(">"),
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /** Source spelling of the operator. */
    public String symbol() {
        return symbol;
    }

    /** Only {@code +} and {@code -} may be used as prefix operators. */
    public boolean isUnary() {
        return this == PLUS || this == MINUS;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}

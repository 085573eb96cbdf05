package io.formulainline.core.model;

/**
 * A node of a parsed formula. The set of node kinds is closed; code that needs to handle every kind
 * implements {@link NodeVisitor} so that a new kind is a compile error everywhere it matters.
 */
public sealed interface Node
        permits NumberLiteral,
                Identifier,
                StringLiteral,
                CellReference,
                RangeReference,
                ArrayLiteral,
                ParenthesizedExpression,
                EmptyArgument,
                UnaryOp,
                BinaryOp,
                FunctionCall {

    <R> R accept(NodeVisitor<R> visitor);
}

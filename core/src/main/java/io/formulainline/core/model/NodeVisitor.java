package io.formulainline.core.model;

/** Double-dispatch over the closed set of {@link Node} kinds. */
public interface NodeVisitor<R> {

    R visitNumber(NumberLiteral node);

    R visitIdentifier(Identifier node);

    R visitString(StringLiteral node);

    R visitCell(CellReference node);

    R visitRange(RangeReference node);

    R visitArray(ArrayLiteral node);

    R visitParenthesized(ParenthesizedExpression node);

    R visitEmptyArgument(EmptyArgument node);

    R visitUnary(UnaryOp node);

    R visitBinary(BinaryOp node);

    R visitCall(FunctionCall node);
}

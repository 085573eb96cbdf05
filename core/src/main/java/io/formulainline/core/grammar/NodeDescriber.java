package io.formulainline.core.grammar;

import io.formulainline.core.model.ArrayLiteral;
import io.formulainline.core.model.BinaryOp;
import io.formulainline.core.model.CellReference;
import io.formulainline.core.model.EmptyArgument;
import io.formulainline.core.model.FunctionCall;
import io.formulainline.core.model.Identifier;
import io.formulainline.core.model.Node;
import io.formulainline.core.model.NodeVisitor;
import io.formulainline.core.model.NumberLiteral;
import io.formulainline.core.model.ParenthesizedExpression;
import io.formulainline.core.model.RangeReference;
import io.formulainline.core.model.StringLiteral;
import io.formulainline.core.model.UnaryOp;
import java.util.stream.Collectors;

/** S-expression description of a tree that ignores spans and string escaping. */
final class NodeDescriber implements NodeVisitor<String> {

    @Override
    public String visitNumber(NumberLiteral node) {
        return "(num " + node.text() + ")";
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return "(id " + node.name() + ")";
    }

    @Override
    public String visitString(StringLiteral node) {
        return "(str " + node.quote() + node.content().replace("\\", "\\\\").replace("\"", "\\\"") + node.quote() + ")";
    }

    @Override
    public String visitCell(CellReference node) {
        return "(cell " + node.text() + ")";
    }

    @Override
    public String visitRange(RangeReference node) {
        return "(range " + node.text() + ")";
    }

    @Override
    public String visitArray(ArrayLiteral node) {
        return node.rows().stream()
                .map(row -> row.stream().map(n -> n.accept(this)).collect(Collectors.joining(" ", "(row ", ")")))
                .collect(Collectors.joining(" ", "(array ", ")"));
    }

    @Override
    public String visitParenthesized(ParenthesizedExpression node) {
        return "(paren " + node.inner().accept(this) + ")";
    }

    @Override
    public String visitEmptyArgument(EmptyArgument node) {
        return "(empty)";
    }

    @Override
    public String visitUnary(UnaryOp node) {
        return "(" + node.op().symbol() + " " + node.operand().accept(this) + ")";
    }

    @Override
    public String visitBinary(BinaryOp node) {
        return "(" + node.op().symbol() + " " + node.left().accept(this) + " " + node.right().accept(this) + ")";
    }

    @Override
    public String visitCall(FunctionCall node) {
        StringBuilder out = new StringBuilder("(call ").append(node.name()).append(" d").append(node.depth());
        for (Node arg : node.args()) {
            out.append(' ').append(arg.accept(this));
        }
        return out.append(')').toString();
    }
}

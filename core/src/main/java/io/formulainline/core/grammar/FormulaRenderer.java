package io.formulainline.core.grammar;

import io.formulainline.core.model.ArrayLiteral;
import io.formulainline.core.model.BinaryOp;
import io.formulainline.core.model.CellReference;
import io.formulainline.core.model.EmptyArgument;
import io.formulainline.core.model.Escaping;
import io.formulainline.core.model.FunctionCall;
import io.formulainline.core.model.Identifier;
import io.formulainline.core.model.Node;
import io.formulainline.core.model.NodeVisitor;
import io.formulainline.core.model.NumberLiteral;
import io.formulainline.core.model.ParenthesizedExpression;
import io.formulainline.core.model.RangeReference;
import io.formulainline.core.model.StringLiteral;
import io.formulainline.core.model.UnaryOp;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree back to formula text. Output reparses to a structurally equal tree.
 *
 * <ul>
 *   <li>binary operators are written with one space on each side, prefix signs touch their operand
 *   <li>call arguments are joined by {@code ", "}; an empty slot gets a bare {@code ","} so
 *       {@code IF(,,)} stays {@code IF(,,)}
 *   <li>arrays are written compactly, {@code {1,2;3,4}}
 *   <li>string literals are re-escaped with the quote and convention they were read with
 *   <li>parenthesized nodes always keep their parentheses
 * </ul>
 *
 * <p>
 * Subclasses may override {@link #visitCall} to substitute text for selected calls.
 */
public class FormulaRenderer implements NodeVisitor<String> {

    /**
     * Renders {@code node} to formula text.
     *
     * @param node tree or subtree to render
     * @return formula text that parses back to the same structure
     */
    public String render(Node node) {
        return node.accept(this);
    }

    /**
     * Span-free structural description of a tree, e.g. {@code (call SUM (cell A1) (empty))}. Two
     * trees are structurally equal exactly when their descriptions are equal.
     *
     * @param node the tree to describe
     * @return an s-expression of the tree
     */
    public static String describe(Node node) {
        return node.accept(new NodeDescriber());
    }

    @Override
    public String visitNumber(NumberLiteral node) {
        return node.text();
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitString(StringLiteral node) {
        String quote = String.valueOf(node.quote());
        String escaped = node.escaping() == Escaping.BACKSLASH
                ? node.content().replace(quote, "\\" + quote)
                : node.content().replace(quote, quote + quote);
        return quote + escaped + quote;
    }

    @Override
    public String visitCell(CellReference node) {
        return node.text();
    }

    @Override
    public String visitRange(RangeReference node) {
        return node.text();
    }

    @Override
    public String visitArray(ArrayLiteral node) {
        return node.rows().stream()
                .map(row -> row.stream().map(this::render).collect(Collectors.joining(",")))
                .collect(Collectors.joining(";", "{", "}"));
    }

    @Override
    public String visitParenthesized(ParenthesizedExpression node) {
        return "(" + render(node.inner()) + ")";
    }

    @Override
    public String visitEmptyArgument(EmptyArgument node) {
        return "";
    }

    @Override
    public String visitUnary(UnaryOp node) {
        return node.op().symbol() + render(node.operand());
    }

    @Override
    public String visitBinary(BinaryOp node) {
        return render(node.left()) + " " + node.op().symbol() + " " + render(node.right());
    }

    @Override
    public String visitCall(FunctionCall node) {
        return node.name() + "(" + renderArguments(node.args()) + ")";
    }

    /** Comma-separated argument list without the surrounding parentheses. */
    protected String renderArguments(List<Node> args) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            String arg = render(args.get(i));
            if (i > 0) {
                out.append(arg.isEmpty() ? "," : ", ");
            }
            out.append(arg);
        }
        return out.toString();
    }
}

package io.formulainline.core.engine;

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
import io.formulainline.core.spi.CallExtractor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Default {@link CallExtractor}: a full tree walk. Every argument position is searched the same way,
 * so a call bound in a {@code LET} or {@code LAMBDA} argument is found like any other.
 */
public final class AstCallExtractor implements CallExtractor {

    static final Comparator<FunctionCall> DEEPEST_FIRST = Comparator.comparingInt(FunctionCall::depth)
            .reversed()
            .thenComparingInt(call -> call.span().start());

    @Override
    public List<FunctionCall> extract(Node root, Set<String> knownNames) {
        List<FunctionCall> found = new ArrayList<>();
        root.accept(new Collector(knownNames, found));
        found.sort(DEEPEST_FIRST);
        return found;
    }

    private static final class Collector implements NodeVisitor<Void> {

        private final Set<String> knownNames;
        private final List<FunctionCall> found;

        Collector(Set<String> knownNames, List<FunctionCall> found) {
            this.knownNames = knownNames;
            this.found = found;
        }

        @Override
        public Void visitNumber(NumberLiteral node) {
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier node) {
            return null;
        }

        @Override
        public Void visitString(StringLiteral node) {
            return null;
        }

        @Override
        public Void visitCell(CellReference node) {
            return null;
        }

        @Override
        public Void visitRange(RangeReference node) {
            return null;
        }

        @Override
        public Void visitArray(ArrayLiteral node) {
            node.rows().forEach(row -> row.forEach(element -> element.accept(this)));
            return null;
        }

        @Override
        public Void visitParenthesized(ParenthesizedExpression node) {
            return node.inner().accept(this);
        }

        @Override
        public Void visitEmptyArgument(EmptyArgument node) {
            return null;
        }

        @Override
        public Void visitUnary(UnaryOp node) {
            return node.operand().accept(this);
        }

        @Override
        public Void visitBinary(BinaryOp node) {
            node.left().accept(this);
            return node.right().accept(this);
        }

        @Override
        public Void visitCall(FunctionCall node) {
            if (knownNames.contains(node.name())) {
                found.add(node);
            }
            node.args().forEach(arg -> arg.accept(this));
            return null;
        }
    }
}

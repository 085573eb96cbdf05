package io.formulainline.core.engine;

import io.formulainline.core.grammar.FormulaRenderer;
import io.formulainline.core.model.FunctionCall;
import java.util.Set;
import java.util.function.Function;

/** Renders a tree with every call to a catalog formula replaced by its call-site expansion. */
final class ExpandingRenderer extends FormulaRenderer {

    private final Set<String> knownNames;
    private final Function<FunctionCall, String> callSite;

    ExpandingRenderer(Set<String> knownNames, Function<FunctionCall, String> callSite) {
        this.knownNames = knownNames;
        this.callSite = callSite;
    }

    @Override
    public String visitCall(FunctionCall node) {
        if (knownNames.contains(node.name())) {
            return callSite.apply(node);
        }
        return super.visitCall(node);
    }
}

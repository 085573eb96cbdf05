package io.formulainline.core.spi;

import io.formulainline.core.model.FunctionCall;
import io.formulainline.core.model.Node;
import java.util.List;
import java.util.Set;

/**
 * Finds the calls to catalog formulas inside a parsed formula. The expansion engine and the linter
 * both go through this seam, so a different traversal can be plugged in without touching either.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface CallExtractor {

    /**
     * Returns every call in {@code root} whose name is in {@code knownNames}.
     *
     * @param root       parsed formula
     * @param knownNames names of catalog formulas; calls to anything else are ignored
     * @return matching calls, deeper calls first, equal depths in source order
     */
    List<FunctionCall> extract(Node root, Set<String> knownNames);
}

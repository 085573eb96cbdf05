package io.formulainline.core.engine;

import io.formulainline.core.error.CatalogParseException;
import io.formulainline.core.model.FormulaDefinition;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of all loaded formula definitions, keyed by name.
 *
 * <p>
 * Names are case-sensitive and iterate in natural order, so everything derived from a registry
 * (graph, cycle reports, generated documents) is deterministic.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class FormulaRegistry {

    private final Map<String, FormulaDefinition> formulas;

    private FormulaRegistry(Map<String, FormulaDefinition> formulas) {
        this.formulas = Collections.unmodifiableMap(new TreeMap<>(formulas));
    }

    /**
     * Creates an empty registry.
     *
     * @return an empty, immutable registry
     */
    public static FormulaRegistry empty() {
        return new FormulaRegistry(Map.of());
    }

    /**
     * Creates a registry holding exactly the given definitions.
     *
     * @param definitions the formulas to register
     * @return the registry
     * @throws CatalogParseException if two definitions share a name
     */
    public static FormulaRegistry of(FormulaDefinition... definitions) {
        Builder builder = builder();
        for (FormulaDefinition definition : definitions) {
            builder.add(definition);
        }
        return builder.build();
    }

    /**
     * Returns a new {@link Builder} for constructing a registry incrementally.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a definition by name.
     *
     * @param name the formula name, case-sensitive
     * @return the definition, or {@code null} if no formula has that name
     */
    public FormulaDefinition get(String name) {
        return formulas.get(name);
    }

    /**
     * Checks whether a formula with this name is registered.
     *
     * @param name the formula name, case-sensitive
     * @return true if the registry holds it
     */
    public boolean contains(String name) {
        return formulas.containsKey(name);
    }

    /**
     * Returns all formula names in natural order.
     *
     * @return unmodifiable sorted set of names
     */
    public Set<String> names() {
        return formulas.keySet();
    }

    /**
     * Returns all definitions in name order.
     *
     * @return unmodifiable view of the definitions
     */
    public Collection<FormulaDefinition> definitions() {
        return formulas.values();
    }

    /**
     * Returns the number of registered formulas.
     *
     * @return formula count
     */
    public int size() {
        return formulas.size();
    }

    /** Accumulates definitions and rejects a second definition under the same name. */
    public static final class Builder {

        private final Map<String, FormulaDefinition> formulas = new TreeMap<>();

        Builder() {}

        /**
         * Adds one definition.
         *
         * @param definition the formula to add
         * @return this builder
         * @throws CatalogParseException if a formula with the same name was already added
         */
        public Builder add(FormulaDefinition definition) {
            FormulaDefinition existing = formulas.putIfAbsent(definition.name(), definition);
            if (existing != null) {
                throw new CatalogParseException(
                        "Duplicate formula name '" + definition.name() + "' (already defined in "
                                + (existing.source() != null ? existing.source() : "<memory>") + ")",
                        definition.name(),
                        definition.source());
            }
            return this;
        }

        /**
         * Builds the immutable registry from the definitions added so far.
         *
         * @return a new registry
         */
        public FormulaRegistry build() {
            return new FormulaRegistry(formulas);
        }
    }
}

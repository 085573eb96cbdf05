package io.formulainline.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named, parameterized formula as loaded from the catalog. Immutable; owned by the registry.
 *
 * @param name        unique, case-sensitive formula name
 * @param version     definition version as written in the catalog
 * @param description human-readable description
 * @param parameters  ordered parameter list, names unique
 * @param body        formula text with comments and the leading {@code =} already removed
 * @param notes       optional free-form notes, or {@code null}
 * @param source      file the definition was loaded from, or {@code null} for in-memory definitions
 */
public record FormulaDefinition(
        String name,
        String version,
        String description,
        List<Parameter> parameters,
        String body,
        String notes,
        String source) {

    public FormulaDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("formula name must not be blank");
        }
        parameters = List.copyOf(parameters);
        Set<String> seen = new HashSet<>();
        for (Parameter parameter : parameters) {
            if (!seen.add(parameter.name())) {
                throw new IllegalArgumentException(
                        "duplicate parameter '" + parameter.name() + "' in formula '" + name + "'");
            }
        }
    }

    /** Convenience factory for definitions built in code. */
    public static FormulaDefinition of(String name, List<String> parameterNames, String body) {
        return new FormulaDefinition(
                name, "1.0.0", "", parameterNames.stream().map(Parameter::named).toList(), body, null, null);
    }

    public List<String> parameterNames() {
        return parameters.stream().map(Parameter::name).toList();
    }
}

package org.contextql.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A reusable boolean condition that queries can opt into by id.
 *
 * @param id          Filter identifier
 * @param name        Display name
 * @param condition   Boolean SQL condition, may contain {@code {param}} placeholders
 * @param parameters  Declared placeholder parameters
 * @param description Free-text description (may be null)
 */
public record NamedFilter(
        String id,
        String name,
        String condition,
        List<FilterParameter> parameters,
        String description) implements ContextElement {

    public NamedFilter {
        Objects.requireNonNull(id, "Filter id cannot be null");
        condition = condition == null ? "" : condition;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static NamedFilter of(String id, String condition) {
        return new NamedFilter(id, id, condition, List.of(), null);
    }

    public Optional<FilterParameter> findParameter(String parameterName) {
        return parameters.stream()
                .filter(p -> p.name().equals(parameterName))
                .findFirst();
    }

    @Override
    public String elementId() {
        return id;
    }

    @Override
    public Kind kind() {
        return Kind.FILTER;
    }
}

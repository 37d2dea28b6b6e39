package org.contextql.model;

import java.util.Objects;

/**
 * A parameter of a named filter, referenced in the condition as {@code {name}}.
 *
 * @param name         Parameter name
 * @param dataType     Declared type ({@code string}, {@code integer}, {@code decimal},
 *                     {@code boolean}, {@code date}); null means string
 * @param defaultValue Value used when the request does not bind one (may be null)
 */
public record FilterParameter(String name, String dataType, String defaultValue) {

    public FilterParameter {
        Objects.requireNonNull(name, "Parameter name cannot be null");
    }
}

package org.contextql.engine.validation;

import org.contextql.engine.execution.DatasetSchema;
import org.contextql.model.ContextDocument;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A context document together with its validation outcome and the store
 * schemas its datasets resolved to.
 *
 * @param document The validated document
 * @param result   The validation outcome
 * @param schemas  Store schema of every dataset that resolved, by local id
 */
public record ValidatedContext(ContextDocument document, ValidationResult result, Map<String, DatasetSchema> schemas) {

    public ValidatedContext {
        Objects.requireNonNull(document, "Document cannot be null");
        Objects.requireNonNull(result, "Result cannot be null");
        schemas = schemas == null ? Map.of() : Map.copyOf(schemas);
    }

    public Optional<DatasetSchema> schema(String localId) {
        return Optional.ofNullable(schemas.get(localId));
    }

    public boolean isUsable() {
        return !result.blocksActivation();
    }
}

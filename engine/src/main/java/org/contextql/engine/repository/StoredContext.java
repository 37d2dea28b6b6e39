package org.contextql.engine.repository;

import org.contextql.engine.validation.ValidationResult;
import org.contextql.model.ContextDocument;
import org.contextql.model.ContextStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * One saved version of a context document.
 *
 * @param document   The document, carrying its lifecycle status
 * @param validation Outcome of the most recent validation, or null if never validated
 * @param ownerId    The user who owns the context
 * @param savedAt    When this version was last written
 */
public record StoredContext(ContextDocument document, ValidationResult validation, String ownerId, Instant savedAt) {

    public StoredContext {
        Objects.requireNonNull(document, "Document cannot be null");
        Objects.requireNonNull(ownerId, "Owner cannot be null");
        Objects.requireNonNull(savedAt, "Timestamp cannot be null");
    }

    public String contextId() {
        return document.id();
    }

    public String version() {
        return document.version();
    }

    public ContextStatus status() {
        return document.status();
    }

    public StoredContext withStatus(ContextStatus status, Instant now) {
        return new StoredContext(document.withStatus(status), validation, ownerId, now);
    }

    public StoredContext withValidation(ValidationResult result, Instant now) {
        return new StoredContext(document, result, ownerId, now);
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }
}

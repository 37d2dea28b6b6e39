package org.contextql.engine.repository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of context document versions, keyed by context id and version.
 *
 * Implementations must be thread-safe and must reject saving an active
 * version when another active version already covers one of its external
 * datasets.
 */
public interface ContextRepository {

    Optional<StoredContext> get(String contextId, String version);

    /**
     * @return All versions of a context in the order they were first saved
     */
    List<StoredContext> versions(String contextId);

    /**
     * @return Every stored version of every context
     */
    List<StoredContext> list();

    /**
     * Inserts or replaces the version identified by the document's id and version.
     *
     * @throws ActiveContextConflictException if the version is active and another
     *                                        active version covers one of its datasets
     */
    void save(StoredContext context);

    /**
     * @return The active version whose datasets include the external dataset
     */
    Optional<StoredContext> findActiveByDataset(String externalDatasetId);

    default Optional<StoredContext> latest(String contextId) {
        List<StoredContext> versions = versions(contextId);
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    default Optional<StoredContext> active(String contextId) {
        return versions(contextId).stream().filter(c -> c.document().isActive()).findFirst();
    }
}

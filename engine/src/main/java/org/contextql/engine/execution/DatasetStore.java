package org.contextql.engine.execution;

import java.util.List;
import java.util.Optional;

/**
 * The store holding the physical datasets a context describes.
 *
 * Tables are addressed by external dataset id. Implementations must be safe
 * for concurrent use.
 */
public interface DatasetStore {

    /**
     * Resolves a dataset the given user owns.
     *
     * @return The dataset's schema, or empty when it does not exist or belongs
     *         to someone else
     * @throws DatasetStoreException if the store cannot be reached
     */
    Optional<DatasetSchema> lookup(String externalDatasetId, String userId);

    /**
     * Executes a query with positional {@code ?} parameters.
     *
     * @throws DatasetStoreException if the query fails
     */
    BufferedResult execute(String queryText, List<Object> parameters);
}

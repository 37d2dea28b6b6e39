package org.contextql.engine.repository;

import org.contextql.model.DatasetRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Heap-backed repository. All access is serialized on the instance.
 */
public class InMemoryContextRepository implements ContextRepository {

    // context id -> version -> stored version, both in first-save order
    private final Map<String, Map<String, StoredContext>> contexts = new LinkedHashMap<>();

    @Override
    public synchronized Optional<StoredContext> get(String contextId, String version) {
        Map<String, StoredContext> versions = contexts.get(contextId);
        return versions == null ? Optional.empty() : Optional.ofNullable(versions.get(version));
    }

    @Override
    public synchronized List<StoredContext> versions(String contextId) {
        Map<String, StoredContext> versions = contexts.get(contextId);
        return versions == null ? List.of() : List.copyOf(versions.values());
    }

    @Override
    public synchronized List<StoredContext> list() {
        List<StoredContext> all = new ArrayList<>();
        contexts.values().forEach(versions -> all.addAll(versions.values()));
        return all;
    }

    @Override
    public synchronized void save(StoredContext context) {
        if (context.document().isActive()) {
            for (DatasetRef dataset : context.document().datasets()) {
                findActiveByDataset(dataset.externalDatasetId())
                        .filter(other -> !sameVersion(other, context))
                        .ifPresent(other -> {
                            throw new ActiveContextConflictException(dataset.externalDatasetId(),
                                    other.contextId(), other.version());
                        });
            }
        }
        contexts.computeIfAbsent(context.contextId(), id -> new LinkedHashMap<>())
                .put(context.version(), context);
    }

    @Override
    public synchronized Optional<StoredContext> findActiveByDataset(String externalDatasetId) {
        return contexts.values().stream()
                .flatMap(versions -> versions.values().stream())
                .filter(c -> c.document().isActive())
                .filter(c -> c.document().findDatasetByExternalId(externalDatasetId).isPresent())
                .findFirst();
    }

    private static boolean sameVersion(StoredContext a, StoredContext b) {
        return a.contextId().equals(b.contextId()) && a.version().equals(b.version());
    }
}

package org.contextql.test;

import org.contextql.engine.execution.BufferedResult;
import org.contextql.engine.execution.Column;
import org.contextql.engine.execution.DatasetSchema;
import org.contextql.engine.execution.DatasetStore;
import org.contextql.engine.execution.DatasetStoreException;
import org.contextql.engine.execution.Row;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dataset store double: schemas are declared up front and every query returns
 * a canned result, optionally after a delay or with a failure.
 */
public class StubDatasetStore implements DatasetStore {

    private final Map<String, DatasetSchema> schemas = new ConcurrentHashMap<>();
    private final List<String> executed = new CopyOnWriteArrayList<>();
    private volatile BufferedResult result = new BufferedResult(List.of(), List.of());
    private volatile Duration delay = Duration.ZERO;
    private volatile String failure;

    public StubDatasetStore dataset(String ownerId, String datasetId, Long rowCount, String... columns) {
        List<Column> cols = new ArrayList<>();
        for (String column : columns) {
            cols.add(Column.of(column, "VARCHAR"));
        }
        schemas.put(datasetId, new DatasetSchema(datasetId, ownerId, cols, rowCount));
        return this;
    }

    /** Declares the datasets of {@link ContextFixtures#SALES}. */
    public static StubDatasetStore sales() {
        return new StubDatasetStore()
                .dataset(ContextFixtures.OWNER, "orders", 1000L, "order_id", "customer_id", "amount", "status")
                .dataset(ContextFixtures.OWNER, "customers", 100L, "customer_id", "name", "region");
    }

    /** Declares the datasets of {@link ContextFixtures#TRIANGLE}. */
    public static StubDatasetStore triangle() {
        return new StubDatasetStore()
                .dataset(ContextFixtures.OWNER, "ds_a", null, "id", "b_id", "a_id", "v")
                .dataset(ContextFixtures.OWNER, "ds_b", null, "id", "c_id", "v")
                .dataset(ContextFixtures.OWNER, "ds_c", null, "id", "a_id", "v");
    }

    public StubDatasetStore returning(List<String> columns, Row... rows) {
        this.result = new BufferedResult(columns.stream().map(c -> Column.of(c, "VARCHAR")).toList(), List.of(rows));
        return this;
    }

    public StubDatasetStore delayedBy(Duration delay) {
        this.delay = delay;
        return this;
    }

    public StubDatasetStore failingWith(String message) {
        this.failure = message;
        return this;
    }

    public StubDatasetStore healthy() {
        this.failure = null;
        this.delay = Duration.ZERO;
        return this;
    }

    public List<String> executed() {
        return List.copyOf(executed);
    }

    @Override
    public Optional<DatasetSchema> lookup(String externalDatasetId, String userId) {
        return Optional.ofNullable(schemas.get(externalDatasetId)).filter(s -> s.ownerId().equals(userId));
    }

    @Override
    public BufferedResult execute(String queryText, List<Object> parameters) {
        executed.add(queryText);
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DatasetStoreException("Interrupted", e);
            }
        }
        if (failure != null) {
            throw new DatasetStoreException(failure);
        }
        return result;
    }
}

package org.contextql.engine.execution;

import org.contextql.engine.transpiler.DuckDBDialect;
import org.contextql.engine.transpiler.SQLDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dataset Store over a single JDBC connection, DuckDB by default.
 *
 * Each dataset is a table named after its external id. Ownership is kept in an
 * in-process registry: a table nobody registered is invisible to
 * {@link #lookup}. Statements are serialized on the connection.
 */
public class JdbcDatasetStore implements DatasetStore, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcDatasetStore.class);

    public static final String IN_MEMORY_URL = "jdbc:duckdb:";

    static {
        try {
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            LOGGER.warn("DuckDB driver not found in classpath");
        }
    }

    private final Connection connection;
    private final SQLDialect dialect;
    private final Map<String, String> owners = new ConcurrentHashMap<>();

    public JdbcDatasetStore(Connection connection, SQLDialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
    }

    /**
     * Opens a private in-memory DuckDB database.
     */
    public static JdbcDatasetStore inMemory() {
        return open(IN_MEMORY_URL);
    }

    public static JdbcDatasetStore open(String jdbcUrl) {
        try {
            return new JdbcDatasetStore(DriverManager.getConnection(jdbcUrl), DuckDBDialect.INSTANCE);
        } catch (SQLException e) {
            throw new DatasetStoreException("Cannot open dataset store at " + jdbcUrl, e);
        }
    }

    /**
     * Creates a table for a new dataset and records its owner.
     *
     * @param columnDefinitions Column list as it appears inside {@code CREATE TABLE (...)}
     */
    public void createDataset(String ownerId, String datasetId, String columnDefinitions) {
        update("CREATE TABLE " + dialect.quoteIdentifier(datasetId) + " (" + columnDefinitions + ")");
        registerDataset(ownerId, datasetId);
    }

    /**
     * Records the owner of an existing table.
     */
    public void registerDataset(String ownerId, String datasetId) {
        owners.put(datasetId, ownerId);
        LOGGER.debug("Registered dataset {} for {}", datasetId, ownerId);
    }

    /**
     * Runs a data-changing statement, typically to load rows.
     *
     * @return The update count
     */
    public int update(String sql, Object... parameters) {
        synchronized (connection) {
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                bind(stmt, Arrays.asList(parameters));
                return stmt.executeUpdate();
            } catch (SQLException e) {
                throw new DatasetStoreException("Update failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public Optional<DatasetSchema> lookup(String externalDatasetId, String userId) {
        String owner = owners.get(externalDatasetId);
        if (owner == null || !owner.equals(userId)) {
            return Optional.empty();
        }
        synchronized (connection) {
            try {
                List<Column> columns = new ArrayList<>();
                try (PreparedStatement stmt = connection.prepareStatement(
                        "SELECT column_name, data_type FROM information_schema.columns "
                                + "WHERE table_name = ? ORDER BY ordinal_position")) {
                    stmt.setString(1, externalDatasetId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            columns.add(Column.of(rs.getString(1), rs.getString(2)));
                        }
                    }
                }
                if (columns.isEmpty()) {
                    return Optional.empty();
                }
                long rows;
                try (Statement stmt = connection.createStatement();
                        ResultSet rs = stmt.executeQuery(
                                "SELECT count(*) FROM " + dialect.quoteIdentifier(externalDatasetId))) {
                    rs.next();
                    rows = rs.getLong(1);
                }
                return Optional.of(new DatasetSchema(externalDatasetId, owner, columns, rows));
            } catch (SQLException e) {
                throw new DatasetStoreException("Lookup of " + externalDatasetId + " failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public BufferedResult execute(String queryText, List<Object> parameters) {
        synchronized (connection) {
            try (PreparedStatement stmt = connection.prepareStatement(queryText)) {
                bind(stmt, parameters);
                try (ResultSet rs = stmt.executeQuery()) {
                    return BufferedResult.fromResultSet(rs);
                }
            } catch (SQLException e) {
                throw new DatasetStoreException("Query failed: " + e.getMessage(), e);
            }
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            stmt.setObject(i + 1, parameters.get(i));
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new DatasetStoreException("Cannot close dataset store", e);
        }
    }
}

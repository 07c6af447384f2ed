package de.bsommerfeld.tassist.core.db;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.tassist.core.error.DatabaseException;
import de.bsommerfeld.tassist.core.error.FileException;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.core.error.NoConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * SQLite connection owned by a {@link de.bsommerfeld.tassist.core.Context}
 * resource entry.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} templates loaded via {@link SqlLoader}.
 * The schema is generated from the registered {@link TableDescriptor}s when
 * the connection opens; every statement uses {@code CREATE TABLE IF NOT EXISTS}
 * so it is safe to re-run against an existing file.
 *
 * <h3>Connection strategy</h3>
 * A single JDBC {@link Connection} is held for the lifetime of this object. An
 * in-memory database only exists as long as its connection, so a connection
 * per operation is not an option. Single statements run in auto-commit mode.
 *
 * <h3>Identifiers</h3>
 * Values are always bound as statement parameters. Table and column names are
 * formatted into the statement text; they must come from registered
 * descriptors, never from user input.
 *
 * @see SqlLoader
 * @see TableDescriptor
 */
public final class DbConnection {

    private static final Logger LOG = LoggerFactory.getLogger(DbConnection.class);

    private static final String IN_MEMORY_URL = "jdbc:sqlite::memory:";

    private final Path dbPath;
    private final List<TableDescriptor<?>> tables;
    private Connection connection;

    private DbConnection(Connection connection, Path dbPath, List<TableDescriptor<?>> tables) {
        this.connection = connection;
        this.dbPath = dbPath;
        this.tables = ImmutableList.copyOf(tables);
    }

    /**
     * Opens a private in-memory database and runs the setup of every table.
     */
    public static DbConnection openInMemory(List<TableDescriptor<?>> tables) throws FrameworkException {
        LOG.info("Opening in-memory database");
        Connection connection = connect(IN_MEMORY_URL);
        return initialize(new DbConnection(connection, null, tables));
    }

    /**
     * Opens (or creates) the database file at {@code path}, creating missing
     * parent directories, and runs the setup of every table.
     *
     * @throws FileException if the parent directory cannot be created
     */
    public static DbConnection openFile(Path path, List<TableDescriptor<?>> tables) throws FrameworkException {
        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        try {
            if (parent != null && !Files.isDirectory(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new FileException("failed to create database directory " + parent, e);
        }
        LOG.info("Opening database at {}", absolute);
        Connection connection = connect("jdbc:sqlite:" + absolute);
        return initialize(new DbConnection(connection, absolute, tables));
    }

    private static Connection connect(String url) throws DatabaseException {
        try {
            return DriverManager.getConnection(url);
        } catch (SQLException e) {
            throw new DatabaseException("failed to open " + url, e);
        }
    }

    private static DbConnection initialize(DbConnection db) throws DatabaseException {
        try {
            db.applySchema();
        } catch (DatabaseException e) {
            db.closeQuietly();
            throw e;
        }
        return db;
    }

    /**
     * Runs every table setup in one transaction; a failing setup leaves no
     * partial schema behind.
     */
    private void applySchema() throws DatabaseException {
        try {
            connection.setAutoCommit(false);
            try {
                for (TableDescriptor<?> table : tables) {
                    table.setup(connection);
                    LOG.debug("Table '{}' ready", table.tableName());
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new DatabaseException("schema setup failed: " + e.getMessage(), e);
        }
        LOG.info("Database schema applied ({} table(s))", tables.size());
    }

    // =====================================================================
    // Row operations
    // =====================================================================

    /**
     * Inserts a row with every column at its default (NULL) value.
     *
     * @return the generated id; the first row of a fresh table gets id 1
     */
    public RowId newRow(String table) throws FrameworkException {
        Connection conn = requireOpen();
        String sql = SqlLoader.format("insert-default-row", table);
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
            try (ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
                rs.next();
                RowId id = RowId.of(rs.getLong(1));
                LOG.debug("Inserted row {} into '{}'", id, table);
                return id;
            }
        } catch (SQLException e) {
            throw failure("insert into " + table, e);
        }
    }

    /**
     * Updates one column of one row. {@code value} may be a plain JDBC value,
     * a {@link RowId}, a {@link LocalDate}, a collection of row ids, an
     * {@link Optional} of any of these, or {@code null}.
     */
    public void setField(String table, RowId row, String field, Object value) throws FrameworkException {
        Connection conn = requireOpen();
        String sql = SqlLoader.format("update-field", table, field);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, toSqlValue(value));
            ps.setLong(2, row.value());
            int updated = ps.executeUpdate();
            LOG.debug("Set {}.{} of row {} ({} row(s) affected)", table, field, row, updated);
        } catch (SQLException e) {
            throw failure("update " + table + "." + field, e);
        }
    }

    /**
     * Reads one column and converts it to {@code type}.
     *
     * <p>
     * Supported targets are {@code String}, {@code Long}, {@code Integer},
     * {@code Double}, {@code Boolean} and {@link RowId}. The stored value must
     * already have the matching storage class: reading an integer column as
     * {@code String} fails, as does reading a NULL column.
     *
     * @throws DatabaseException if the row is absent, the column is NULL or the
     *                           stored value has a different type
     */
    public <T> T getField(String table, RowId row, String field, Class<T> type) throws FrameworkException {
        Object raw = getRawField(table, row, field);
        return convert(raw, type, table + "." + field + " of row " + row);
    }

    /**
     * Reads one column as the JDBC driver returns it.
     *
     * @return the raw value, or {@code null} for SQL NULL
     * @throws DatabaseException if the row is absent
     */
    public Object getRawField(String table, RowId row, String field) throws FrameworkException {
        Connection conn = requireOpen();
        String sql = SqlLoader.format("select-field", field, table);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, row.value());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new DatabaseException("no row with id " + row + " in table " + table);
                }
                return rs.getObject(1);
            }
        } catch (SQLException e) {
            throw failure("select " + table + "." + field, e);
        }
    }

    /**
     * Deletes a row. Deleting an id that does not exist affects zero rows and
     * is not an error.
     */
    public void removeRow(String table, RowId row) throws FrameworkException {
        Connection conn = requireOpen();
        String sql = SqlLoader.format("delete-row", table);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, row.value());
            int removed = ps.executeUpdate();
            LOG.debug("Removed row {} from '{}' ({} row(s) affected)", row, table, removed);
        } catch (SQLException e) {
            throw failure("delete from " + table, e);
        }
    }

    /** All row ids of {@code table}, ascending, which is insertion order. */
    public List<RowId> rowIds(String table) throws FrameworkException {
        Connection conn = requireOpen();
        String sql = SqlLoader.format("select-row-ids", table);
        List<RowId> ids = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                ids.add(RowId.of(rs.getLong(1)));
            }
        } catch (SQLException e) {
            throw failure("list rows of " + table, e);
        }
        return ids;
    }

    // =====================================================================
    // Schema & lifecycle
    // =====================================================================

    /** The descriptors whose setup ran when this connection opened. */
    public List<TableDescriptor<?>> tables() {
        return tables;
    }

    public Optional<TableDescriptor<?>> table(String name) {
        return tables.stream().filter(t -> t.tableName().equals(name)).findFirst();
    }

    public boolean isOpen() {
        return connection != null;
    }

    /** The database file, or empty for an in-memory connection. */
    public Optional<Path> dbPath() {
        return Optional.ofNullable(dbPath);
    }

    /**
     * Closes the connection and deletes the database file. For an in-memory
     * database closing discards all data.
     *
     * @throws NoConnectionException if the connection is already closed
     * @throws FileException         if the file cannot be deleted
     */
    public void deleteDatabase() throws FrameworkException {
        Connection conn = requireOpen();
        try {
            conn.close();
        } catch (SQLException e) {
            throw new DatabaseException("failed to close connection", e);
        } finally {
            connection = null;
        }
        if (dbPath != null) {
            try {
                Files.deleteIfExists(dbPath);
            } catch (IOException e) {
                throw new FileException("failed to delete database file " + dbPath, e);
            }
            LOG.info("Deleted database file {}", dbPath);
        } else {
            LOG.info("Closed in-memory database");
        }
    }

    /**
     * Closes the connection without deleting anything. Closing a closed
     * connection does nothing.
     */
    public void close() throws DatabaseException {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new DatabaseException("failed to close connection", e);
        } finally {
            connection = null;
        }
        LOG.info("Closed database connection");
    }

    /**
     * Copies the whole database into {@code target} using SQLite's online
     * backup. An existing file is overwritten.
     *
     * @throws FileException if the path contains a double quote
     */
    public void backup(Path target) throws FrameworkException {
        Path absolute = maintenancePath(target);
        runMaintenance(SqlLoader.format("backup-database", absolute), "backup to " + absolute);
        LOG.info("Backed up database to {}", absolute);
    }

    /**
     * Replaces the content of this database with the content of
     * {@code source}.
     *
     * @throws FileException if {@code source} does not exist or its path
     *                       contains a double quote
     */
    public void restore(Path source) throws FrameworkException {
        Path absolute = maintenancePath(source);
        if (!Files.isRegularFile(absolute)) {
            throw new FileException("backup file not found: " + absolute);
        }
        runMaintenance(SqlLoader.format("restore-database", absolute), "restore from " + absolute);
        LOG.info("Restored database from {}", absolute);
    }

    // The driver reads the file name up to the next '"', so it cannot be escaped.
    private static Path maintenancePath(Path path) throws FileException {
        Path absolute = path.toAbsolutePath();
        if (absolute.toString().indexOf('"') >= 0) {
            throw new FileException("file path must not contain '\"': " + absolute);
        }
        return absolute;
    }

    private void runMaintenance(String sql, String description) throws FrameworkException {
        Connection conn = requireOpen();
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
        } catch (SQLException e) {
            throw failure(description, e);
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private Connection requireOpen() throws NoConnectionException {
        if (connection == null) {
            throw new NoConnectionException();
        }
        return connection;
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close connection after setup failure", e);
        }
        connection = null;
    }

    private static DatabaseException failure(String operation, SQLException e) {
        return new DatabaseException(operation + " failed: " + e.getMessage(), e);
    }

    /** Maps the value types of the marshalling layer to JDBC values. */
    static Object toSqlValue(Object value) {
        if (value instanceof Optional<?> optional) {
            return toSqlValue(optional.orElse(null));
        }
        if (value instanceof RowId rowId) {
            return rowId.value();
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        if (value instanceof Collection<?> values) {
            return Joiner.on(',').join(values);
        }
        return value;
    }

    private static <T> T convert(Object raw, Class<T> type, String where) throws DatabaseException {
        Preconditions.checkNotNull(type, "type must not be null");
        if (raw == null) {
            throw new DatabaseException(where + " is NULL");
        }
        Object converted = null;
        if (type == String.class) {
            converted = raw instanceof String ? raw : null;
        } else if (type == Long.class) {
            converted = isInteger(raw) ? Long.valueOf(((Number) raw).longValue()) : null;
        } else if (type == Integer.class) {
            if (isInteger(raw)) {
                long value = ((Number) raw).longValue();
                converted = value == (int) value ? Integer.valueOf((int) value) : null;
            }
        } else if (type == Double.class) {
            converted = raw instanceof Number number ? Double.valueOf(number.doubleValue()) : null;
        } else if (type == Boolean.class) {
            converted = isInteger(raw) ? Boolean.valueOf(((Number) raw).longValue() != 0) : null;
        } else if (type == RowId.class) {
            converted = isInteger(raw) ? RowId.of(((Number) raw).longValue()) : null;
        } else if (type.isInstance(raw)) {
            converted = raw;
        }
        if (converted == null) {
            throw new DatabaseException(where + " holds " + raw.getClass().getSimpleName()
                    + " '" + raw + "', expected " + type.getSimpleName());
        }
        return type.cast(converted);
    }

    private static boolean isInteger(Object raw) {
        return raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte;
    }
}

package de.bsommerfeld.tassist.core.db;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.tassist.core.error.FrameworkException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Binds a table name to the record type stored in it.
 *
 * <p>
 * Descriptors are immutable and registered with
 * {@link de.bsommerfeld.tassist.core.Context#addTable}. The connection runs
 * {@link #setup} for each of them when it opens; command handlers and tabs
 * then load, store and display rows through the descriptor rather than
 * touching columns directly.
 *
 * <pre>
 * context.addTable(TableDescriptor.of("trainer", Trainer.class));
 * </pre>
 *
 * @param <R> the record type of one row
 */
public final class TableDescriptor<R extends Record> {

    public static final String ID_HEADER = "ID";

    private final String tableName;
    private final RowMapper<R> mapper;

    private TableDescriptor(String tableName, RowMapper<R> mapper) {
        this.tableName = tableName;
        this.mapper = mapper;
    }

    /**
     * @throws IllegalArgumentException if {@code tableName} is not a plain
     *                                  identifier or a component type has no
     *                                  marshaller
     */
    public static <R extends Record> TableDescriptor<R> of(String tableName, Class<R> rowType) {
        return of(tableName, RowMapper.of(rowType));
    }

    public static <R extends Record> TableDescriptor<R> of(String tableName, RowMapper<R> mapper) {
        Preconditions.checkArgument(tableName != null && tableName.matches("[A-Za-z_][A-Za-z0-9_]*"),
                "invalid table name: %s", tableName);
        return new TableDescriptor<>(tableName, mapper);
    }

    public String tableName() {
        return tableName;
    }

    public Class<R> rowType() {
        return mapper.rowType();
    }

    public List<FieldInfo> fields() {
        return mapper.fields();
    }

    public List<String> columnNames() {
        return mapper.columnNames();
    }

    public boolean hasColumn(String column) {
        return mapper.columnNames().contains(column);
    }

    /** {@value #ID_HEADER} followed by the column names. */
    public List<String> header() {
        return ImmutableList.<String>builder().add(ID_HEADER).addAll(mapper.columnNames()).build();
    }

    public void setup(Connection connection) throws SQLException {
        mapper.setup(connection, tableName);
    }

    public R load(DbConnection db, RowId row) throws FrameworkException {
        return mapper.load(db, tableName, row);
    }

    public void store(DbConnection db, RowId row, R record) throws FrameworkException {
        mapper.store(db, tableName, row, record);
    }

    /** Inserts a new row holding {@code record}. */
    public RowId insert(DbConnection db, R record) throws FrameworkException {
        RowId row = db.newRow(tableName);
        mapper.store(db, tableName, row, record);
        return row;
    }

    /** Display cells of one row, aligned with {@link #header()}. */
    public List<String> displayRow(DbConnection db, RowId row) {
        return mapper.displayRow(db, tableName, row);
    }

    @Override
    public String toString() {
        return "TableDescriptor[" + tableName + " -> " + rowType().getSimpleName() + "]";
    }
}

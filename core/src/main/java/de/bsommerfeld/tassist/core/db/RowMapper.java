package de.bsommerfeld.tassist.core.db;

import com.google.common.base.CaseFormat;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.field.FieldMarshaller;
import de.bsommerfeld.tassist.core.db.field.MarshallerRegistry;
import de.bsommerfeld.tassist.core.error.DatabaseException;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reflective mapping between a record type and the columns of a table.
 *
 * <p>
 * Each record component becomes one column named after the component in
 * lower_underscore form ({@code companyName} → {@code company_name}), typed by
 * the component's {@link FieldMarshaller}. Loading a row reads every column
 * and calls the canonical constructor.
 *
 * <p>
 * The component metadata is resolved once per record type and cached; an
 * unsupported component type fails at that point with an
 * {@link IllegalArgumentException}, i.e. when the table is declared rather than
 * when it is first read.
 *
 * @param <R> the mapped record type
 */
public final class RowMapper<R extends Record> {

    private static final Logger LOG = LoggerFactory.getLogger(RowMapper.class);

    private static final ConcurrentHashMap<Class<?>, RowMapper<?>> CACHE = new ConcurrentHashMap<>();

    private final Class<R> rowType;
    private final Constructor<R> constructor;
    private final List<FieldInfo> fields;

    private RowMapper(Class<R> rowType, Constructor<R> constructor, List<FieldInfo> fields) {
        this.rowType = rowType;
        this.constructor = constructor;
        this.fields = fields;
    }

    /** The cached mapper for {@code rowType}, built with the default registry. */
    @SuppressWarnings("unchecked")
    public static <R extends Record> RowMapper<R> of(Class<R> rowType) {
        return (RowMapper<R>) CACHE.computeIfAbsent(rowType,
                type -> create(rowType, MarshallerRegistry.getDefault()));
    }

    /** Builds an uncached mapper against a custom registry. */
    public static <R extends Record> RowMapper<R> create(Class<R> rowType, MarshallerRegistry registry) {
        Preconditions.checkArgument(rowType.isRecord(), "%s is not a record", rowType.getName());
        RecordComponent[] components = rowType.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        ImmutableList.Builder<FieldInfo> fields = ImmutableList.builder();

        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            parameterTypes[i] = component.getType();
            TypeToken<?> type = TypeToken.of(component.getGenericType());
            if (!registry.supports(type)) {
                throw new IllegalArgumentException("no field marshaller for " + rowType.getSimpleName()
                        + "." + component.getName() + " of type " + type);
            }
            Method accessor = component.getAccessor();
            accessor.setAccessible(true);
            fields.add(new FieldInfo(
                    columnName(component.getName()),
                    type,
                    registry.lookup(type),
                    Optional.ofNullable(component.getAnnotation(DisplayTable.class)),
                    accessor));
        }

        Constructor<R> constructor;
        try {
            constructor = rowType.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("no canonical constructor on " + rowType.getName(), e);
        }
        RowMapper<R> mapper = new RowMapper<>(rowType, constructor, fields.build());
        LOG.debug("Mapped {} to columns {}", rowType.getSimpleName(), mapper.fields);
        return mapper;
    }

    static String columnName(String componentName) {
        return CaseFormat.LOWER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, componentName);
    }

    public Class<R> rowType() {
        return rowType;
    }

    public List<FieldInfo> fields() {
        return fields;
    }

    public List<String> columnNames() {
        return fields.stream().map(FieldInfo::column).collect(ImmutableList.toImmutableList());
    }

    /** Creates {@code table} unless it exists. */
    public void setup(Connection connection, String table) throws SQLException {
        StringBuilder columns = new StringBuilder();
        for (FieldInfo field : fields) {
            columns.append(", ").append(field.column()).append(' ').append(field.sqlType());
        }
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(SqlLoader.format("create-table", table, columns));
        }
    }

    /**
     * Reads every column of one row into a record.
     *
     * @throws FrameworkException if the row is absent, any field fails to
     *                            convert or the record's constructor rejects
     *                            the values
     */
    public R load(DbConnection db, String table, RowId row) throws FrameworkException {
        Object[] args = new Object[fields.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = fields.get(i).read(db, table, row);
        }
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new DatabaseException("row " + row + " of '" + table + "' was rejected by "
                    + rowType.getSimpleName() + ": " + e.getCause(), e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("cannot construct " + rowType.getName(), e);
        }
    }

    /** Writes every component of {@code record} into the row. */
    public void store(DbConnection db, String table, RowId row, R record) throws FrameworkException {
        for (FieldInfo field : fields) {
            db.setField(table, row, field.column(), field.toSql(field.valueOf(record)));
        }
    }

    /**
     * Display cells of one row: the id followed by one cell per field. A row
     * that fails to load shows {@code Err} in the first field cell and blanks
     * after it.
     */
    public List<String> displayRow(DbConnection db, String table, RowId row) {
        List<String> cells = new ArrayList<>(fields.size() + 1);
        cells.add(row.toString());
        R record;
        try {
            record = load(db, table, row);
        } catch (FrameworkException e) {
            LOG.debug("Row {} of '{}' failed to load: {}", row, table, e.getMessage());
            if (!fields.isEmpty()) {
                cells.add("Err");
            }
            while (cells.size() < fields.size() + 1) {
                cells.add("");
            }
            return cells;
        }
        for (FieldInfo field : fields) {
            cells.add(field.display(field.valueOf(record), db));
        }
        return cells;
    }
}

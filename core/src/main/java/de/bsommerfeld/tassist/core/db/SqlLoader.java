package de.bsommerfeld.tassist.core.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statement templates from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Templates contain {@code %s} placeholders for table and column names, which
 * are filled with {@link String#format}. Values are never interpolated; they
 * are bound as {@link java.sql.PreparedStatement} parameters.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-default-row.sql}, {@code select-field.sql}.
 *
 * @see DbConnection
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL template from {@code sql/<name>.sql} on the classpath.
     *
     * @param name the file stem without path prefix or extension
     * @return the trimmed template
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /** Loads {@code name} and fills its placeholders with identifiers. */
    public static String format(String name, Object... identifiers) {
        return String.format(load(name), identifiers);
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}

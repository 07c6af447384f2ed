package de.bsommerfeld.tassist.core.db;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link RowId} component that references a row of another table.
 * Listings show the referenced row's {@link #column()} instead of the bare id.
 *
 * <pre>
 * public record Session(LocalDate date,
 *                       &#64;DisplayTable(table = "trainer", column = "name") RowId trainer) {
 * }
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface DisplayTable {

    String table();

    String column();
}

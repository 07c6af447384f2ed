package de.bsommerfeld.tassist.core.db;

/**
 * Identity of a row within one table, as generated by SQLite's
 * {@code INTEGER PRIMARY KEY AUTOINCREMENT}. Ids are never reused, not even
 * the id of the most recently removed row.
 */
public record RowId(long value) implements Comparable<RowId> {

    public static RowId of(long value) {
        return new RowId(value);
    }

    @Override
    public int compareTo(RowId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}

package de.bsommerfeld.tassist.db;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain ASCII grid used by the {@code list} command and the table editor.
 *
 * <pre>
 * +----+------+
 * | ID | name |
 * +----+------+
 * | 1  | Err  |
 * +----+------+
 * </pre>
 *
 * Every column is as wide as its widest cell, cells are left aligned with one
 * space of padding, and a rule separates every row.
 */
final class TextTable {

    private final List<String> header;
    private final List<List<String>> rows = new ArrayList<>();

    TextTable(List<String> header) {
        Preconditions.checkArgument(!header.isEmpty(), "table needs at least one column");
        this.header = ImmutableList.copyOf(header);
    }

    /** Adds a row. Missing trailing cells render empty, surplus cells are dropped. */
    TextTable row(List<String> cells) {
        List<String> row = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            row.add(i < cells.size() && cells.get(i) != null ? cells.get(i) : "");
        }
        rows.add(row);
        return this;
    }

    int rowCount() {
        return rows.size();
    }

    /** The rendered grid, one entry per output line. */
    List<String> lines() {
        int[] widths = new int[header.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = header.get(i).length();
            for (List<String> row : rows) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        String rule = rule(widths);
        List<String> lines = new ArrayList<>(rows.size() * 2 + 3);
        lines.add(rule);
        lines.add(cells(header, widths));
        lines.add(rule);
        for (List<String> row : rows) {
            lines.add(cells(row, widths));
            lines.add(rule);
        }
        return lines;
    }

    String render() {
        return String.join("\n", lines());
    }

    @Override
    public String toString() {
        return render();
    }

    private static String rule(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append(Strings.repeat("-", width + 2)).append('+');
        }
        return sb.toString();
    }

    private static String cells(List<String> values, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(Strings.padEnd(values.get(i), widths[i], ' ')).append(" |");
        }
        return sb.toString();
    }
}

package com.tsforecast.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Submitted rows viewed as a table. Column order is the order in which column names first
 * appear across the rows; a row lacking a column reads as {@code null} for it.
 */
public final class RawTable {

    private final List<RawRecord> rows;
    private final List<String> columns;

    private RawTable(List<RawRecord> rows, List<String> columns) {
        this.rows = rows;
        this.columns = columns;
    }

    public static RawTable of(List<RawRecord> rows) {
        LinkedHashSet<String> columns = new LinkedHashSet<>();
        rows.forEach(r -> columns.addAll(r.columns()));
        return new RawTable(List.copyOf(rows), List.copyOf(new ArrayList<>(columns)));
    }

    public List<RawRecord> rows() {
        return rows;
    }

    public List<String> columns() {
        return columns;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}

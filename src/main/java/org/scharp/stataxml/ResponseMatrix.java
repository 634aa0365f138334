package org.scharp.stataxml;

import java.util.ArrayList;
import java.util.List;

/**
 * The buffered responses of an export: one row per response, one cell per column.
 * <p>
 * Rows are appended while responses are ingested.  Afterward, the cells are replaced in place by the recoder, but the
 * matrix never changes shape.
 * </p>
 */
final class ResponseMatrix {

    private final int totalColumns;
    private final List<String[]> rows;

    ResponseMatrix(int totalColumns) {
        this.totalColumns = totalColumns;
        this.rows = new ArrayList<>();
    }

    /**
     * Appends a row.  The row's values are copied.
     *
     * @param row
     *     The raw values of one response, in column order.
     *
     * @throws NullPointerException
     *     if {@code row} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code row} doesn't have one value per column.
     */
    void addRow(List<String> row) {
        ArgumentUtil.checkNotNull(row, "response");
        if (totalColumns != row.size()) {
            throw new IllegalArgumentException(
                "response has too " + (totalColumns < row.size() ? "many" : "few") +
                    " values, expected " + totalColumns + " but got " + row.size());
        }

        // A null value is a missing response.
        String[] cells = new String[totalColumns];
        int i = 0;
        for (String value : row) {
            cells[i] = value == null ? "" : value;
            i++;
        }
        rows.add(cells);
    }

    String get(int row, int column) {
        return rows.get(row)[column];
    }

    void set(int row, int column, String value) {
        assert value != null : "cells must not be null";
        rows.get(row)[column] = value;
    }

    int totalRows() {
        return rows.size();
    }

    int totalColumns() {
        return totalColumns;
    }
}

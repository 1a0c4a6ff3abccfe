package org.dxworks.ralfgen.model;

import org.dxworks.ralfgen.Column;

import java.util.List;

/**
 * The raw contents of one sheet: header names in sheet order and the data rows below them.
 */
public final class RowTable {

    private final List<String> columns;
    private final List<Row> rows;

    public RowTable(List<String> columns, List<Row> rows) {
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public boolean hasColumn(Column column) {
        return columns.contains(column.getName());
    }
}

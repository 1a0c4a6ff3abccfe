package org.dxworks.ralfgen.normalizer;

import org.dxworks.ralfgen.Column;
import org.dxworks.ralfgen.model.Row;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Last non-empty value seen so far for each fill-down column. One instance per pass over a table.
 */
final class FillBuffer {

    private final List<Column> columns;
    private final Map<Column, String> lastSeen = new EnumMap<>(Column.class);

    FillBuffer(List<Column> columns) {
        this.columns = List.copyOf(columns);
    }

    Row fill(Row row) {
        Row filled = row;
        for (Column column : columns) {
            if (row.isEmpty(column)) {
                String carried = lastSeen.get(column);
                if (carried != null) {
                    filled = filled.withValue(column, carried);
                }
            } else {
                lastSeen.put(column, row.get(column));
            }
        }
        return filled;
    }
}

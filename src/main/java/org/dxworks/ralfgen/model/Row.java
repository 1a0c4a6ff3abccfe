package org.dxworks.ralfgen.model;

import org.dxworks.ralfgen.Column;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One spreadsheet row, keyed by header name. Absent cells read as the empty string.
 */
public final class Row {

    private final Map<String, String> values;

    public Row(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(Column column) {
        return get(column.getName());
    }

    public String get(String columnName) {
        String value = values.get(columnName);
        return value == null ? "" : value;
    }

    public boolean isEmpty(Column column) {
        return get(column).isBlank();
    }

    public Row withValue(Column column, String value) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(column.getName(), value);
        return new Row(copy);
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}

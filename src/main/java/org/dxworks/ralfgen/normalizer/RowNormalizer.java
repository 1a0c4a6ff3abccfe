package org.dxworks.ralfgen.normalizer;

import org.dxworks.ralfgen.Column;
import org.dxworks.ralfgen.SchemaException;
import org.dxworks.ralfgen.model.Row;
import org.dxworks.ralfgen.model.RowTable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Validates the header of a sheet and fills sparse identifying columns downwards.
 *
 * - BlockName, RegName, RegOffset and (when the sheet has it) Hierarchy inherit the value of the
 *   closest non-empty cell above them, column by column.
 * - A leading run of empty cells stays empty.
 * - All other columns pass through untouched.
 */
public final class RowNormalizer {

    private RowNormalizer() {}

    public static List<Row> normalize(RowTable table) {
        requireColumns(table.getColumns());

        List<Column> fillColumns = Column.fillDownColumns().stream()
            .filter(table::hasColumn)
            .collect(Collectors.toList());

        FillBuffer buffer = new FillBuffer(fillColumns);
        List<Row> normalized = new ArrayList<>(table.getRows().size());
        for (Row row : table.getRows()) {
            normalized.add(buffer.fill(row));
        }
        return normalized;
    }

    public static void requireColumns(List<String> columns) {
        List<String> missing = Column.requiredColumns().stream()
            .map(Column::getName)
            .filter(name -> !columns.contains(name))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }
    }
}

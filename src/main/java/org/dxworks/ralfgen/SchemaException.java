package org.dxworks.ralfgen;

import java.util.List;

/**
 * Thrown when the input table lacks one or more required columns.
 */
public class SchemaException extends RuntimeException {

    private final List<String> missingColumns;

    public SchemaException(List<String> missingColumns) {
        super("Input table is missing required columns: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}

package org.dxworks.ralfgen.decoder;

import org.dxworks.ralfgen.Column;
import org.dxworks.ralfgen.model.BitRange;
import org.dxworks.ralfgen.model.RalfField;
import org.dxworks.ralfgen.model.Row;

import java.util.Locale;
import java.util.Optional;

/**
 * Turns one normalized row into at most one field.
 */
public final class FieldMaterializer {

    private static final String RESERVED = "reserved";
    private static final String DEFAULT_ACCESS = "rw";

    private FieldMaterializer() {}

    public static Optional<RalfField> materialize(Row row, boolean hierarchyPresent) {
        String fieldName = row.get(Column.FIELD_NAME);
        if (fieldName.isBlank()) return Optional.empty();
        if (RESERVED.equalsIgnoreCase(fieldName.trim())) return Optional.empty();

        Optional<BitRange> bits = BitRangeDecoder.decode(row.get(Column.BIT));
        if (bits.isEmpty()) return Optional.empty();

        BitRange range = bits.get();
        int width = range.getWidth();
        int lsb = range.getLow();

        String access = normalizeAccess(row.get(Column.ACCESS));
        String reset = ResetValueDecoder.decode(row.get(Column.RESET_VALUE))
            .flatMap(value -> ResetValueDecoder.toLiteral(value, width))
            .orElse(null);

        return Optional.of(new RalfField(displayName(fieldName, row, hierarchyPresent), lsb, width, access, reset));
    }

    static String normalizeAccess(String cell) {
        String access = cell.trim().toLowerCase(Locale.ROOT);
        if (access.isEmpty()) return DEFAULT_ACCESS;
        // RALF spells read-only as "ro"
        if ("r".equals(access)) return "ro";
        return access;
    }

    private static String displayName(String fieldName, Row row, boolean hierarchyPresent) {
        if (hierarchyPresent && !row.isEmpty(Column.HIERARCHY)) {
            return fieldName + " (" + row.get(Column.HIERARCHY) + ")";
        }
        return fieldName;
    }
}

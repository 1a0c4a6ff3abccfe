package org.dxworks.ralfgen.normalizer;

import org.dxworks.ralfgen.Column;
import org.dxworks.ralfgen.SchemaException;
import org.dxworks.ralfgen.model.Row;
import org.dxworks.ralfgen.model.RowTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.ralfgen.TestUtils.HEADER;
import static org.dxworks.ralfgen.TestUtils.HEADER_WITH_HIERARCHY;
import static org.dxworks.ralfgen.TestUtils.table;
import static org.junit.jupiter.api.Assertions.*;

public class RowNormalizerTest {

    @Test
    void fillsIdentifyingColumnsDownIndependently() {
        RowTable input = table(HEADER,
                new String[]{"GPIO", "CTRL", "0x10", "0", "EN", "rw", "0", ""},
                new String[]{"", "", "", "1", "MODE", "rw", "0", ""},
                new String[]{"", "STAT", "0x14", "0", "BUSY", "r", "", ""},
                new String[]{"UART", "", "", "0", "TXE", "r", "", ""});

        List<Row> rows = RowNormalizer.normalize(input);

        assertEquals(4, rows.size());
        assertEquals("GPIO", rows.get(1).get(Column.BLOCK_NAME));
        assertEquals("CTRL", rows.get(1).get(Column.REG_NAME));
        assertEquals("0x10", rows.get(1).get(Column.REG_OFFSET));
        assertEquals("GPIO", rows.get(2).get(Column.BLOCK_NAME));
        assertEquals("STAT", rows.get(2).get(Column.REG_NAME));
        assertEquals("UART", rows.get(3).get(Column.BLOCK_NAME));
        assertEquals("STAT", rows.get(3).get(Column.REG_NAME));
        assertEquals("0x14", rows.get(3).get(Column.REG_OFFSET));
    }

    @Test
    void leadingEmptyCellsStayEmpty() {
        RowTable input = table(HEADER,
                new String[]{"", "CTRL", "0x0", "0", "EN"},
                new String[]{"", "", "", "1", "GO"},
                new String[]{"GPIO", "", "", "2", "IRQ"});

        List<Row> rows = RowNormalizer.normalize(input);

        assertEquals("", rows.get(0).get(Column.BLOCK_NAME));
        assertEquals("", rows.get(1).get(Column.BLOCK_NAME));
        assertEquals("CTRL", rows.get(1).get(Column.REG_NAME));
        assertEquals("GPIO", rows.get(2).get(Column.BLOCK_NAME));
    }

    @Test
    void doesNotFillFieldLevelColumns() {
        RowTable input = table(HEADER,
                new String[]{"GPIO", "CTRL", "0x0", "7:0", "EN", "rw", "0x1", "enable"},
                new String[]{"", "", "", "", "", "", "", ""});

        Row second = RowNormalizer.normalize(input).get(1);

        assertEquals("", second.get(Column.BIT));
        assertEquals("", second.get(Column.FIELD_NAME));
        assertEquals("", second.get(Column.ACCESS));
        assertEquals("", second.get(Column.RESET_VALUE));
        assertEquals("", second.get(Column.DESCRIPTION));
    }

    @Test
    void whitespaceOnlyCellsAreFilled() {
        RowTable input = table(HEADER,
                new String[]{"GPIO", "CTRL", "0x0", "0", "EN"},
                new String[]{"  ", " ", "\t", "1", "GO"});

        Row second = RowNormalizer.normalize(input).get(1);

        assertEquals("GPIO", second.get(Column.BLOCK_NAME));
        assertEquals("CTRL", second.get(Column.REG_NAME));
        assertEquals("0x0", second.get(Column.REG_OFFSET));
    }

    @Test
    void fillsHierarchyWhenPresent() {
        RowTable input = table(HEADER_WITH_HIERARCHY,
                new String[]{"DDR", "MSTR", "0x0", "0", "lpddr5", "rw", "0", "", "u_apb.slvif"},
                new String[]{"", "", "", "1", "ddr4", "rw", "0", "", ""});

        List<Row> rows = RowNormalizer.normalize(input);

        assertEquals("u_apb.slvif", rows.get(1).get(Column.HIERARCHY));
    }

    @Test
    void firstRowWithAllIdentifiersNeedsNoFurtherInput() {
        RowTable input = table(HEADER,
                new String[]{"GPIO", "CTRL", "0x10", "0", "A"},
                new String[]{"", "", "", "1", "B"},
                new String[]{"", "", "", "2", "C"});

        for (Row row : RowNormalizer.normalize(input)) {
            assertFalse(row.isEmpty(Column.BLOCK_NAME));
            assertFalse(row.isEmpty(Column.REG_NAME));
            assertFalse(row.isEmpty(Column.REG_OFFSET));
        }
    }

    @Test
    void leavesInputRowsUntouched() {
        RowTable input = table(HEADER,
                new String[]{"GPIO", "CTRL", "0x10", "0", "A"},
                new String[]{"", "", "", "1", "B"});

        RowNormalizer.normalize(input);

        assertEquals("", input.getRows().get(1).get(Column.BLOCK_NAME));
    }

    @Test
    void missingColumnFailsBeforeProcessing() {
        List<String> header = new ArrayList<>(HEADER);
        header.remove("Access");
        RowTable input = table(header, new String[]{"GPIO", "CTRL", "0x10", "0", "EN", "0", ""});

        SchemaException e = assertThrows(SchemaException.class, () -> RowNormalizer.normalize(input));
        assertEquals(List.of("Access"), e.getMissingColumns());
        assertTrue(e.getMessage().contains("Access"));
    }

    @Test
    void reportsEveryMissingColumnInSchemaOrder() {
        RowTable input = new RowTable(List.of("Description", "FieldName", "Bit"), List.of());

        SchemaException e = assertThrows(SchemaException.class, () -> RowNormalizer.normalize(input));
        assertEquals(List.of("BlockName", "RegName", "RegOffset", "Access", "ResetValue"), e.getMissingColumns());
    }

    @Test
    void hierarchyIsOptional() {
        RowTable input = table(HEADER, new String[]{"GPIO", "CTRL", "0x10", "0", "EN"});

        assertDoesNotThrow(() -> RowNormalizer.normalize(input));
    }
}

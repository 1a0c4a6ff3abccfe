package org.dxworks.ralfgen.loader;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.dxworks.ralfgen.model.Row;
import org.dxworks.ralfgen.model.RowTable;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one sheet of an .xlsx/.xls workbook. The first physical row is the header; every later
 * row that is not entirely blank becomes a {@link Row} keyed by header name.
 */
public final class SpreadsheetLoader {

    private SpreadsheetLoader() {}

    /**
     * @param sheet sheet name, or a zero-based index when no sheet has that name; null selects the first sheet
     */
    public static RowTable load(Path workbookPath, String sheet) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(workbookPath.toFile(), null, true)) {
            return readSheet(selectSheet(workbook, sheet));
        }
    }

    static Sheet selectSheet(Workbook workbook, String selector) {
        if (selector == null || selector.isBlank()) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IllegalArgumentException("Workbook contains no sheets");
            }
            return workbook.getSheetAt(0);
        }

        Sheet byName = workbook.getSheet(selector);
        if (byName != null) {
            return byName;
        }

        if (selector.chars().allMatch(Character::isDigit)) {
            int index = Integer.parseInt(selector);
            if (index < workbook.getNumberOfSheets()) {
                return workbook.getSheetAt(index);
            }
        }
        throw new IllegalArgumentException("Sheet not found: " + selector);
    }

    static RowTable readSheet(Sheet sheet) {
        org.apache.poi.ss.usermodel.Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            return new RowTable(List.of(), List.of());
        }

        // column index -> header name; first occurrence of a duplicated header wins
        Map<Integer, String> headers = new LinkedHashMap<>();
        for (Cell cell : headerRow) {
            String name = cellText(cell).trim();
            if (!name.isEmpty() && !headers.containsValue(name)) {
                headers.put(cell.getColumnIndex(), name);
            }
        }

        List<Row> rows = new ArrayList<>();
        for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            org.apache.poi.ss.usermodel.Row sheetRow = sheet.getRow(r);
            if (sheetRow == null) continue;

            Map<String, String> values = new LinkedHashMap<>();
            boolean blank = true;
            for (Map.Entry<Integer, String> header : headers.entrySet()) {
                String text = cellText(sheetRow.getCell(header.getKey()));
                if (!text.isBlank()) {
                    blank = false;
                }
                values.put(header.getValue(), text);
            }
            if (!blank) {
                rows.add(new Row(values));
            }
        }

        return new RowTable(new ArrayList<>(headers.values()), rows);
    }

    static String cellText(Cell cell) {
        if (cell == null) return "";
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }

        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                return numericText(cell.getNumericCellValue());
            case BOOLEAN:
                return Boolean.toString(cell.getBooleanCellValue());
            default:
                return "";
        }
    }

    /**
     * Integral numbers lose the ".0" spreadsheets attach to them, so 16 stays "16" and 7 stays "7".
     */
    static String numericText(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}

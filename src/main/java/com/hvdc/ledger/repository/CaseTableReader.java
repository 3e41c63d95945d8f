package com.hvdc.ledger.repository;

import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.exception.CaseTableReadException;
import com.hvdc.ledger.model.CaseRecord;
import com.hvdc.ledger.model.CaseTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the case list sheet of a workbook into a {@link CaseTable}.
 *
 * The first non-empty row is the header. Date-formatted cells become {@code LocalDateTime},
 * other numbers {@code Double}, text is trimmed; blank cells are dropped. Whether a location
 * value is a usable date is decided later, during event extraction.
 */
@Repository
@Slf4j
public class CaseTableReader {

    public static final String DEFAULT_SHEET = "CASE LIST";

    private final LedgerSettings settings;

    public CaseTableReader(LedgerSettings settings) {
        this.settings = settings;
    }

    public CaseTable read(Path path, String sheetName) {
        if (!Files.isRegularFile(path)) {
            throw new CaseTableReadException("Case list file not found: " + path);
        }
        log.info("Reading case list from {} (sheet '{}')", path, sheetName);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, sheetName);
        } catch (IOException e) {
            throw new CaseTableReadException("Cannot read case list " + path + ": " + e.getMessage(), e);
        }
    }

    public CaseTable read(InputStream in, String sheetName) {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = sheetName != null ? workbook.getSheet(sheetName) : workbook.getSheetAt(0);
            if (sheet == null) {
                throw new CaseTableReadException("Sheet '" + sheetName + "' not found");
            }
            return readSheet(sheet);
        } catch (IOException e) {
            throw new CaseTableReadException("Cannot open workbook: " + e.getMessage(), e);
        }
    }

    private CaseTable readSheet(Sheet sheet) {
        int headerIdx = findHeaderRow(sheet);
        if (headerIdx < 0) {
            throw new CaseTableReadException("Sheet '" + sheet.getSheetName() + "' has no header row");
        }

        Row headerRow = sheet.getRow(headerIdx);
        Map<Integer, String> columnsByIndex = new HashMap<>();
        List<String> columns = new ArrayList<>();
        for (Cell cell : headerRow) {
            Object value = cellValue(cell);
            if (value != null) {
                String name = value.toString().trim();
                columnsByIndex.put(cell.getColumnIndex(), name);
                columns.add(name);
            }
        }

        String idColumn = match(columns, settings.idColumn());
        String quantityColumn = match(columns, settings.quantityColumn());
        String categoryColumn = match(columns, settings.categoryColumn());

        List<CaseRecord> cases = new ArrayList<>();
        int dataRow = 0;
        for (int rowIdx = headerIdx + 1; rowIdx <= sheet.getLastRowNum(); rowIdx++) {
            Row row = sheet.getRow(rowIdx);
            if (row == null) {
                continue;
            }
            Map<String, Object> cells = new HashMap<>();
            for (Cell cell : row) {
                String column = columnsByIndex.get(cell.getColumnIndex());
                Object value = cellValue(cell);
                if (column != null && value != null) {
                    cells.put(column, value);
                }
            }
            if (cells.isEmpty()) {
                continue;
            }
            cases.add(toRecord(cells, dataRow++, idColumn, quantityColumn, categoryColumn));
        }

        log.info("Loaded {} cases, {} columns from sheet '{}'", cases.size(), columns.size(), sheet.getSheetName());
        CaseTable table = new CaseTable(columns, cases);
        List<String> duplicates = table.duplicateIds();
        if (!duplicates.isEmpty()) {
            log.warn("{} case ids appear on more than one row, each row is kept as its own case: {}",
                    duplicates.size(), duplicates);
        }
        return table;
    }

    private CaseRecord toRecord(Map<String, Object> cells, int dataRow,
                                String idColumn, String quantityColumn, String categoryColumn) {
        Object id = idColumn != null ? cells.get(idColumn) : null;
        String caseId = id != null ? asText(id) : "Row_" + dataRow;
        int quantity = quantityColumn != null ? asQuantity(cells.get(quantityColumn)) : 1;
        Object category = categoryColumn != null ? cells.get(categoryColumn) : null;
        return new CaseRecord(caseId, quantity, category != null ? asText(category) : null, cells);
    }

    private static int findHeaderRow(Sheet sheet) {
        for (int rowIdx = sheet.getFirstRowNum(); rowIdx <= sheet.getLastRowNum(); rowIdx++) {
            Row row = sheet.getRow(rowIdx);
            if (row == null) {
                continue;
            }
            for (Cell cell : row) {
                if (cellValue(cell) != null) {
                    return rowIdx;
                }
            }
        }
        return -1;
    }

    private static String match(List<String> columns, String wanted) {
        if (wanted == null) {
            return null;
        }
        String key = wanted.trim().toLowerCase(Locale.ROOT);
        return columns.stream()
                .filter(c -> c.toLowerCase(Locale.ROOT).equals(key))
                .findFirst()
                .orElse(null);
    }

    static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue().trim();
                return text.isEmpty() ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    static String asText(Object value) {
        if (value instanceof Double number && number == Math.rint(number) && !number.isInfinite()) {
            return String.valueOf(number.longValue());
        }
        return value.toString().trim();
    }

    static int asQuantity(Object value) {
        if (value instanceof Number number) {
            return Math.max(1, (int) number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return Math.max(1, (int) Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                log.debug("Invalid quantity '{}', using 1", text);
            }
        }
        return 1;
    }
}

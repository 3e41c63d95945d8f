package com.hvdc.ledger.repository;

import com.hvdc.ledger.TestFixtures;
import com.hvdc.ledger.exception.CaseTableReadException;
import com.hvdc.ledger.model.CaseRecord;
import com.hvdc.ledger.model.CaseTable;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CaseTableReader against workbooks built in memory.
 */
class CaseTableReaderTest {

    private CaseTableReader reader;

    @BeforeEach
    void setUp() {
        reader = new CaseTableReader(TestFixtures.settings());
    }

    private static byte[] workbook() throws IOException {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            workbook.createSheet("SUMMARY");
            Sheet sheet = workbook.createSheet(CaseTableReader.DEFAULT_SHEET);
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            // row 0 left empty: header is the first non-empty row
            Row header = sheet.createRow(1);
            String[] columns = {"Case No.", "Quantity", "Material Category", "WH1", "WH2", "S1"};
            for (int i = 0; i < columns.length; i++) {
                header.createCell(i).setCellValue(columns[i]);
            }

            Row first = sheet.createRow(2);
            first.createCell(0).setCellValue(207721.0);
            first.createCell(1).setCellValue(3.0);
            first.createCell(2).setCellValue("Electrical");
            first.createCell(3).setCellValue(LocalDate.of(2023, 1, 5));
            first.getCell(3).setCellStyle(dateStyle);
            first.createCell(5).setCellValue(LocalDate.of(2023, 5, 1));
            first.getCell(5).setCellStyle(dateStyle);

            sheet.createRow(3);

            Row second = sheet.createRow(4);
            second.createCell(1).setCellValue("n/a");
            second.createCell(4).setCellValue("  2023-03-10 ");

            workbook.write(out);
            return out.toByteArray();
        }
    }

    @Test
    @DisplayName("Should read header, cases and typed cells from the case list sheet")
    void shouldReadCaseList() throws Exception {
        // When
        CaseTable table = reader.read(new ByteArrayInputStream(workbook()), CaseTableReader.DEFAULT_SHEET);

        // Then
        assertThat(table.columns()).containsExactly("Case No.", "Quantity", "Material Category", "WH1", "WH2", "S1");
        assertThat(table.cases()).hasSize(2);

        CaseRecord first = table.cases().get(0);
        assertThat(first.caseId()).isEqualTo("207721");
        assertThat(first.quantity()).isEqualTo(3);
        assertThat(first.category()).isEqualTo("Electrical");
        assertThat(first.cell("WH1")).isEqualTo(LocalDateTime.of(2023, 1, 5, 0, 0));
        assertThat(first.cell("WH2")).isNull();
    }

    @Test
    @DisplayName("Should name rows without an id and default unreadable quantities to one")
    void shouldFillMissingIdAndQuantity() throws Exception {
        CaseTable table = reader.read(new ByteArrayInputStream(workbook()), CaseTableReader.DEFAULT_SHEET);

        CaseRecord second = table.cases().get(1);
        assertThat(second.caseId()).isEqualTo("Row_1");
        assertThat(second.quantity()).isEqualTo(1);
        assertThat(second.cell("WH2")).isEqualTo("2023-03-10");
    }

    @Test
    @DisplayName("Should read from a file and fail clearly for a missing sheet or file")
    void shouldReadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("cases.xlsx");
        try (OutputStream out = Files.newOutputStream(file)) {
            out.write(workbook());
        }

        assertThat(reader.read(file, CaseTableReader.DEFAULT_SHEET).cases()).hasSize(2);
        // first sheet is the empty summary sheet
        assertThatThrownBy(() -> reader.read(file, null))
                .isInstanceOf(CaseTableReadException.class)
                .hasMessageContaining("no header row");
        assertThatThrownBy(() -> reader.read(file, "NOPE"))
                .isInstanceOf(CaseTableReadException.class)
                .hasMessageContaining("NOPE");
        assertThatThrownBy(() -> reader.read(dir.resolve("missing.xlsx"), null))
                .isInstanceOf(CaseTableReadException.class);
    }

    @Test
    @DisplayName("Should write whole numbers as integer text")
    void shouldFormatIds() {
        assertThat(CaseTableReader.asText(12.0)).isEqualTo("12");
        assertThat(CaseTableReader.asText(12.5)).isEqualTo("12.5");
        assertThat(CaseTableReader.asText(" HE-01 ")).isEqualTo("HE-01");
        assertThat(CaseTableReader.asQuantity("4")).isEqualTo(4);
        assertThat(CaseTableReader.asQuantity(0.0)).isEqualTo(1);
        assertThat(CaseTableReader.asQuantity(null)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep every row when a case id repeats and report the repeated ids")
    void shouldKeepRowsWithRepeatedIds() throws Exception {
        // Given
        byte[] bytes;
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(CaseTableReader.DEFAULT_SHEET);
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Case No.");
            header.createCell(1).setCellValue("WH1");
            String[][] rows = {{"HE-1", "2023-01-05"}, {"HE-2", "2023-02-01"}, {"HE-1", "2023-04-11"}};
            for (int i = 0; i < rows.length; i++) {
                Row row = sheet.createRow(i + 1);
                row.createCell(0).setCellValue(rows[i][0]);
                row.createCell(1).setCellValue(rows[i][1]);
            }
            workbook.write(out);
            bytes = out.toByteArray();
        }

        // When
        CaseTable table = reader.read(new ByteArrayInputStream(bytes), CaseTableReader.DEFAULT_SHEET);

        // Then
        assertThat(table.cases()).extracting(CaseRecord::caseId).containsExactly("HE-1", "HE-2", "HE-1");
        assertThat(table.cases().stream().map(c -> c.cell("WH1")).toList()).containsExactly("2023-01-05", "2023-02-01", "2023-04-11");
        assertThat(table.duplicateIds()).containsExactly("HE-1");
    }
}

package com.example.roster.service.output;

import com.example.roster.model.AttendeeRecord;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class XlsxRecordWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesHeaderRowAndOneRowPerRecord() throws IOException {
        Path target = tempDir.resolve("participants.xlsx");

        new XlsxRecordWriter().write(List.of(
                new AttendeeRecord("ARGENTINA", "", "Jane Roe", "Dept. of Wildlife"),
                new AttendeeRecord("BRAZIL", "Sr.", "Luis Silva", "IBAMA")), target);

        try (InputStream in = Files.newInputStream(target);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheet(WorkbookRecordWriter.SHEET_NAME);
            assertThat(sheet).isNotNull();
            assertThat(sheet.getLastRowNum()).isEqualTo(2);

            Row header = sheet.getRow(0);
            assertThat(header.getCell(2).getStringCellValue()).isEqualTo("Person_Name");
            assertThat(workbook.getFontAt(header.getCell(0).getCellStyle().getFontIndex()).getBold()).isTrue();

            Row first = sheet.getRow(1);
            assertThat(first.getCell(0).getStringCellValue()).isEqualTo("ARGENTINA");
            assertThat(first.getCell(1).getStringCellValue()).isEmpty();
            assertThat(first.getCell(3).getStringCellValue()).isEqualTo("Dept. of Wildlife");
            assertThat(sheet.getRow(2).getCell(2).getStringCellValue()).isEqualTo("Luis Silva");
        }
    }
}

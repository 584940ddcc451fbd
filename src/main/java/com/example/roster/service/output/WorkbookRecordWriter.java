package com.example.roster.service.output;

import com.example.roster.model.AttendeeRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Spreadsheet output through POI's format-neutral usermodel. Subclasses pick the file format.
 */
public abstract class WorkbookRecordWriter implements RecordWriter {

    static final String SHEET_NAME = "Participants";

    protected abstract Workbook createWorkbook();

    @Override
    public void write(List<AttendeeRecord> records, Path target) throws IOException {
        try (Workbook workbook = createWorkbook();
             OutputStream out = Files.newOutputStream(target)) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);

            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            Row header = sheet.createRow(0);
            for (int c = 0; c < AttendeeRecord.COLUMNS.size(); c++) {
                Cell cell = header.createCell(c);
                cell.setCellValue(AttendeeRecord.COLUMNS.get(c));
                cell.setCellStyle(headerStyle);
            }

            int rowIndex = 1;
            for (AttendeeRecord record : records) {
                Row row = sheet.createRow(rowIndex++);
                List<String> values = record.toRow();
                for (int c = 0; c < values.size(); c++) {
                    row.createCell(c).setCellValue(values.get(c));
                }
            }
            workbook.write(out);
        }
    }
}

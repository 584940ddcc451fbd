package com.example.roster.service.output;

import com.example.roster.model.AttendeeRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * UTF-8 CSV with a byte-order mark so spreadsheet applications pick the right encoding.
 */
@Component
public class CsvRecordWriter implements RecordWriter {

    static final char BOM = '\uFEFF';
    private static final String ROW_SEPARATOR = "\r\n";

    @Override
    public void write(List<AttendeeRecord> records, Path target) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(BOM);
            writeRow(writer, AttendeeRecord.COLUMNS);
            for (AttendeeRecord record : records) {
                writeRow(writer, record.toRow());
            }
        }
    }

    private void writeRow(BufferedWriter writer, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(values.get(i)));
        }
        writer.write(ROW_SEPARATOR);
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean quote = value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        if (!quote) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}

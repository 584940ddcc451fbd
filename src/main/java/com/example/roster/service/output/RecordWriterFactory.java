package com.example.roster.service.output;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks the output format from the target file extension; CSV unless told otherwise.
 */
@Component
public class RecordWriterFactory {

    private final CsvRecordWriter csvRecordWriter;
    private final XlsxRecordWriter xlsxRecordWriter;
    private final XlsRecordWriter xlsRecordWriter;
    private final JsonRecordWriter jsonRecordWriter;

    public RecordWriterFactory(CsvRecordWriter csvRecordWriter,
                               XlsxRecordWriter xlsxRecordWriter,
                               XlsRecordWriter xlsRecordWriter,
                               JsonRecordWriter jsonRecordWriter) {
        this.csvRecordWriter = csvRecordWriter;
        this.xlsxRecordWriter = xlsxRecordWriter;
        this.xlsRecordWriter = xlsRecordWriter;
        this.jsonRecordWriter = jsonRecordWriter;
    }

    public RecordWriter forTarget(Path target) {
        String extension = extensionOf(target);
        switch (extension) {
            case "xlsx":
                return xlsxRecordWriter;
            case "xls":
                return xlsRecordWriter;
            case "json":
                return jsonRecordWriter;
            default:
                return csvRecordWriter;
        }
    }

    static String extensionOf(Path target) {
        Path fileName = target.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

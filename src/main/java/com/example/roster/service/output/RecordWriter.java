package com.example.roster.service.output;

import com.example.roster.model.AttendeeRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface RecordWriter {

    /**
     * Writes a header row followed by one row per record, replacing any existing file.
     */
    void write(List<AttendeeRecord> records, Path target) throws IOException;
}

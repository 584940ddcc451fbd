package com.example.roster.service.output;

import com.example.roster.model.AttendeeRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON array of row objects keyed by the column names.
 */
@Component
public class JsonRecordWriter implements RecordWriter {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void write(List<AttendeeRecord> records, Path target) throws IOException {
        objectMapper.writeValue(target.toFile(), records);
    }
}

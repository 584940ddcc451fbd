package com.example.roster.service.output;

import com.example.roster.model.AttendeeRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class JsonRecordWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesArrayOfObjectsKeyedByColumnName() throws IOException {
        Path target = tempDir.resolve("participants.json");

        new JsonRecordWriter().write(List.of(new AttendeeRecord("CHILE", "Dr.", "Ana Ruiz", "CONAF")), target);

        List<LinkedHashMap<String, String>> rows = new ObjectMapper()
                .readValue(target.toFile(), new TypeReference<List<LinkedHashMap<String, String>>>() { });
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).containsExactly(
                entry("Delegation", "CHILE"),
                entry("Honorific", "Dr."),
                entry("Person_Name", "Ana Ruiz"),
                entry("Affiliation", "CONAF"));
    }
}

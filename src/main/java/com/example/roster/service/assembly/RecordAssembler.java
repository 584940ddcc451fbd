package com.example.roster.service.assembly;

import com.example.roster.dto.layout.Token;
import com.example.roster.model.AttendeeRecord;
import com.example.roster.model.ExtractionStrategy;
import com.example.roster.model.TokenGranularity;

import java.util.List;

/**
 * Turns the tokens of one page into attendee records.
 */
public interface RecordAssembler {

    ExtractionStrategy strategy();

    /**
     * @param pageTokens  every token of the page, in any order
     * @param granularity how the tokens rebuild into line text
     * @param xThreshold  column boundary in page points
     * @return records in reading order, empty for an empty page
     */
    List<AttendeeRecord> assemble(List<Token> pageTokens, TokenGranularity granularity, double xThreshold);
}

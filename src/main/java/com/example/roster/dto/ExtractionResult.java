package com.example.roster.dto;

import com.example.roster.model.AttendeeRecord;
import com.example.roster.model.LayoutMode;
import lombok.Value;

import java.util.List;

/**
 * Records of one document plus the 1-based page numbers by outcome.
 */
@Value
public class ExtractionResult {
    List<AttendeeRecord> records;
    LayoutMode layoutMode;
    boolean ocr;
    List<Integer> processedPages;
    List<Integer> emptyPages;
    List<Integer> failedPages;

    public ExtractionResult(List<AttendeeRecord> records, LayoutMode layoutMode, boolean ocr,
                            List<Integer> processedPages, List<Integer> emptyPages, List<Integer> failedPages) {
        this.records = List.copyOf(records);
        this.layoutMode = layoutMode;
        this.ocr = ocr;
        this.processedPages = List.copyOf(processedPages);
        this.emptyPages = List.copyOf(emptyPages);
        this.failedPages = List.copyOf(failedPages);
    }

    public int getPageCount() {
        return processedPages.size() + emptyPages.size() + failedPages.size();
    }
}

package com.example.roster.service.assembly;

import com.example.roster.dto.layout.Header;
import com.example.roster.dto.layout.HonorificSplit;
import com.example.roster.dto.layout.Line;
import com.example.roster.dto.layout.Paragraph;
import com.example.roster.dto.layout.Token;
import com.example.roster.model.AttendeeRecord;
import com.example.roster.model.ExtractionStrategy;
import com.example.roster.model.TokenGranularity;
import com.example.roster.service.layout.ColumnSplitter;
import com.example.roster.service.layout.HeaderClassifier;
import com.example.roster.service.layout.HonorificParser;
import com.example.roster.service.layout.LineClusterer;
import com.example.roster.service.layout.ParagraphSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Two-column rosters (and every OCR page) with all-caps delegation headers.
 * <p>
 * Headers are detected once over the whole page, because a header may sit above
 * both columns. Each column is then segmented on its own; every paragraph that is
 * not itself a header becomes one person: first line for the name, the rest for
 * the affiliation. Left column records come before right column records.
 */
@Component
public class TwoColumnRecordAssembler implements RecordAssembler {

    private static final Logger logger = LoggerFactory.getLogger(TwoColumnRecordAssembler.class);

    private final ColumnSplitter columnSplitter;
    private final LineClusterer lineClusterer;
    private final ParagraphSegmenter paragraphSegmenter;
    private final HeaderClassifier headerClassifier;
    private final HonorificParser honorificParser;

    public TwoColumnRecordAssembler(ColumnSplitter columnSplitter,
                                    LineClusterer lineClusterer,
                                    ParagraphSegmenter paragraphSegmenter,
                                    HeaderClassifier headerClassifier,
                                    HonorificParser honorificParser) {
        this.columnSplitter = columnSplitter;
        this.lineClusterer = lineClusterer;
        this.paragraphSegmenter = paragraphSegmenter;
        this.headerClassifier = headerClassifier;
        this.honorificParser = honorificParser;
    }

    @Override
    public ExtractionStrategy strategy() {
        return ExtractionStrategy.TWO_COLUMN;
    }

    @Override
    public List<AttendeeRecord> assemble(List<Token> pageTokens, TokenGranularity granularity, double xThreshold) {
        if (pageTokens == null || pageTokens.isEmpty()) {
            return new ArrayList<>();
        }

        List<Line> pageLines = lineClusterer.cluster(pageTokens, granularity);
        List<Header> headers = headerClassifier.detectHeaders(paragraphSegmenter.segment(pageLines));

        List<List<Paragraph>> columns = columnSplitter.split(pageTokens, xThreshold).stream()
                .map(column -> paragraphSegmenter.segment(lineClusterer.cluster(column, granularity)))
                .collect(Collectors.toList());

        List<AttendeeRecord> records = assembleColumns(headers, columns);
        logger.debug("Two-column page: {} tokens, {} headers, {} records",
                pageTokens.size(), headers.size(), records.size());
        return records;
    }

    /**
     * @param headers page headers ordered by midpoint
     * @param columns paragraphs of each column, left column first
     */
    public List<AttendeeRecord> assembleColumns(List<Header> headers, List<List<Paragraph>> columns) {
        List<AttendeeRecord> records = new ArrayList<>();
        for (List<Paragraph> paragraphs : columns) {
            for (Paragraph paragraph : paragraphs) {
                if (paragraph.getLines().isEmpty() || headerClassifier.isHeader(paragraph)) {
                    continue;
                }
                HonorificSplit split = honorificParser.split(paragraph.firstLine().trim());
                String affiliation = paragraph.getLines().stream()
                        .skip(1)
                        .map(String::trim)
                        .collect(Collectors.joining(" "))
                        .trim();
                String delegation = headerClassifier.delegationAt(paragraph.getMidY(), headers);
                records.add(new AttendeeRecord(delegation, split.getHonorific(), split.getPerson(), affiliation));
            }
        }
        return records;
    }
}

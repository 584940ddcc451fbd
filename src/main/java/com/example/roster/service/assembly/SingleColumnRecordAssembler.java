package com.example.roster.service.assembly;

import com.example.roster.dto.layout.HonorificSplit;
import com.example.roster.dto.layout.Line;
import com.example.roster.dto.layout.Token;
import com.example.roster.model.AttendeeRecord;
import com.example.roster.model.ExtractionStrategy;
import com.example.roster.model.TokenGranularity;
import com.example.roster.service.layout.HeaderClassifier;
import com.example.roster.service.layout.HonorificParser;
import com.example.roster.service.layout.LineClusterer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-column rosters typeset with bold delegation names.
 * <p>
 * A bold line opens a delegation. The next plain line names a person and the plain
 * lines directly under it, up to a bold or blank line, are that person's affiliation.
 * Plain lines above the first bold line of the page are ignored.
 */
@Component
public class SingleColumnRecordAssembler implements RecordAssembler {

    private static final Logger logger = LoggerFactory.getLogger(SingleColumnRecordAssembler.class);

    private final LineClusterer lineClusterer;
    private final HonorificParser honorificParser;

    public SingleColumnRecordAssembler(LineClusterer lineClusterer, HonorificParser honorificParser) {
        this.lineClusterer = lineClusterer;
        this.honorificParser = honorificParser;
    }

    @Override
    public ExtractionStrategy strategy() {
        return ExtractionStrategy.SINGLE_COLUMN;
    }

    @Override
    public List<AttendeeRecord> assemble(List<Token> pageTokens, TokenGranularity granularity, double xThreshold) {
        List<Line> lines = lineClusterer.cluster(pageTokens, granularity);
        List<AttendeeRecord> records = assembleLines(lines);
        logger.debug("Single-column page: {} tokens, {} lines, {} records",
                pageTokens == null ? 0 : pageTokens.size(), lines.size(), records.size());
        return records;
    }

    public List<AttendeeRecord> assembleLines(List<Line> lines) {
        List<AttendeeRecord> records = new ArrayList<>();
        String delegation = "";
        int i = 0;
        while (i < lines.size()) {
            Line line = lines.get(i);
            if (line.isBold() && !line.isBlank()) {
                delegation = HeaderClassifier.sectionName(line.getText());
                i++;
                continue;
            }
            if (delegation.isEmpty() || line.isBlank()) {
                i++;
                continue;
            }

            HonorificSplit split = honorificParser.split(line.getText());
            i++;
            List<String> affiliation = new ArrayList<>();
            while (i < lines.size() && !lines.get(i).isBold() && !lines.get(i).isBlank()) {
                affiliation.add(lines.get(i).getText().trim());
                i++;
            }
            records.add(new AttendeeRecord(delegation, split.getHonorific(), split.getPerson(),
                    String.join(" ", affiliation).trim()));
        }
        return records;
    }
}

package com.example.roster.service.layout;

import com.example.roster.dto.layout.Line;
import com.example.roster.dto.layout.Paragraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits an ordered run of lines into paragraphs.
 * <p>
 * The reference spacing is the lower median of the gaps between consecutive line
 * midpoints of the same run, so every page gets its own threshold. A new paragraph
 * starts wherever a gap exceeds {@code median * factor}.
 */
@Component
public class ParagraphSegmenter {

    private static final Logger logger = LoggerFactory.getLogger(ParagraphSegmenter.class);

    private final double paragraphFactor;

    public ParagraphSegmenter(@Value("${roster.paragraph.factor:1.5}") double paragraphFactor) {
        this.paragraphFactor = paragraphFactor;
    }

    public List<Paragraph> segment(List<Line> lines) {
        List<Paragraph> paragraphs = new ArrayList<>();
        if (lines == null || lines.isEmpty()) {
            return paragraphs;
        }
        if (lines.size() == 1) {
            Line only = lines.get(0);
            paragraphs.add(new Paragraph(List.of(only.getText()), only.getY0(), only.getY1()));
            return paragraphs;
        }

        double threshold = gapThreshold(lines);
        logger.trace("Paragraph gap threshold {} over {} lines", threshold, lines.size());

        List<String> current = new ArrayList<>();
        double blockY0 = 0.0;
        double blockY1 = 0.0;
        double previousMid = Double.NaN;

        for (Line line : lines) {
            double mid = line.getMidY();
            if (!current.isEmpty() && mid - previousMid > threshold) {
                paragraphs.add(new Paragraph(current, blockY0, blockY1));
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                blockY0 = line.getY0();
            }
            current.add(line.getText());
            blockY1 = line.getY1();
            previousMid = mid;
        }
        paragraphs.add(new Paragraph(current, blockY0, blockY1));
        return paragraphs;
    }

    /**
     * Requires at least two lines.
     */
    double gapThreshold(List<Line> lines) {
        double[] gaps = new double[lines.size() - 1];
        for (int i = 0; i < gaps.length; i++) {
            gaps[i] = lines.get(i + 1).getMidY() - lines.get(i).getMidY();
        }
        Arrays.sort(gaps);
        double median = gaps[(gaps.length - 1) / 2];
        return median * paragraphFactor;
    }
}

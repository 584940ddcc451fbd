package com.example.roster.service.layout;

import com.example.roster.dto.layout.Token;
import com.example.roster.model.LayoutMode;
import com.example.roster.service.source.TokenSource;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * One-shot guess of the document layout from its first pages: a page whose tokens
 * fall on both sides of the column threshold, each side holding at least
 * {@code minColumnShare} of them, marks the document as two-column.
 */
@Component
public class LayoutModeDetector {

    private static final Logger logger = LoggerFactory.getLogger(LayoutModeDetector.class);

    private final int samplePages;
    private final double minColumnShare;

    public LayoutModeDetector(@Value("${roster.layout.sample-pages:2}") int samplePages,
                              @Value("${roster.layout.min-column-share:0.25}") double minColumnShare) {
        this.samplePages = samplePages;
        this.minColumnShare = minColumnShare;
    }

    public LayoutMode detect(PDDocument document, TokenSource source, double xThreshold) {
        int pages = Math.min(samplePages, document.getNumberOfPages());
        for (int pageIndex = 0; pageIndex < pages; pageIndex++) {
            List<Token> tokens;
            try {
                tokens = source.readPage(document, pageIndex);
            } catch (IOException | RuntimeException e) {
                logger.warn("Layout detection skipped page {}: {}", pageIndex + 1, e.getMessage());
                continue;
            }
            if (isTwoColumnPage(tokens, xThreshold)) {
                logger.debug("Page {} splits at x={}, assuming two columns", pageIndex + 1, xThreshold);
                return LayoutMode.TWO;
            }
        }
        return LayoutMode.SINGLE;
    }

    public boolean isTwoColumnPage(List<Token> tokens, double xThreshold) {
        if (tokens == null || tokens.isEmpty()) {
            return false;
        }
        int left = 0;
        int right = 0;
        for (Token token : tokens) {
            if (token.getX0() < xThreshold) {
                left++;
            } else {
                right++;
            }
        }
        double total = left + right;
        double leftShare = left / total;
        double rightShare = right / total;
        logger.debug("Column shares left={} right={}", String.format("%.2f", leftShare), String.format("%.2f", rightShare));
        return leftShare >= minColumnShare && rightShare >= minColumnShare;
    }
}

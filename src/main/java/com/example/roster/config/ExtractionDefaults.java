package com.example.roster.config;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * Per-run defaults that the command line may override.
 */
@Configuration
@Getter
public class ExtractionDefaults {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionDefaults.class);

    @Value("${roster.column.x-threshold:260.0}")
    private double xThreshold;

    @Value("${roster.ocr.dpi:300}")
    private int ocrDpi;

    @Value("${roster.ocr.language:eng}")
    private String ocrLanguage;

    @Value("${roster.ocr.fallback-on-empty-page:false}")
    private boolean ocrFallback;

    @Value("${tesseract.datapath:}")
    private String tessdataPath;

    @PostConstruct
    public void logDefaults() {
        logger.debug("Extraction defaults: x-threshold={}, ocr-dpi={}, ocr-language={}, ocr-fallback={}",
                xThreshold, ocrDpi, ocrLanguage, ocrFallback);
    }
}

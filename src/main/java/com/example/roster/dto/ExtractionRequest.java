package com.example.roster.dto;

import com.example.roster.model.LayoutOverride;
import lombok.Builder;
import lombok.Value;

import java.io.File;

/**
 * Options for one document run.
 */
@Value
@Builder
public class ExtractionRequest {
    File pdfFile;

    @Builder.Default
    LayoutOverride layout = LayoutOverride.AUTO;

    @Builder.Default
    double xThreshold = 260.0;

    boolean forceOcr;

    /** Re-read pages without a text layer through OCR. */
    boolean ocrFallback;

    @Builder.Default
    int ocrDpi = 300;

    @Builder.Default
    String ocrLanguage = "eng";

    String tessdataPath;

    String tesseractLibraryPath;

    public boolean needsOcr() {
        return forceOcr || ocrFallback;
    }
}

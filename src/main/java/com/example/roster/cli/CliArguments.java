package com.example.roster.cli;

import com.example.roster.model.LayoutOverride;
import picocli.CommandLine;

import java.io.File;
import java.nio.file.Path;

@CommandLine.Command(name = "roster-extractor", mixinStandardHelpOptions = true,
        description = "Extract participant lists from roster PDFs into CSV, XLSX or JSON")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "PDF", description = "Input PDF")
    private File pdf;

    @CommandLine.Option(names = {"-o", "--out"}, defaultValue = "participants.csv", paramLabel = "FILE",
            description = "Output file; .xlsx/.xls, .json or anything else for CSV (default: ${DEFAULT-VALUE})")
    private Path out = Path.of("participants.csv");

    @CommandLine.Option(names = "--layout", converter = LayoutOverrideConverter.class, defaultValue = "auto",
            description = "Layout: auto, one or two (default: ${DEFAULT-VALUE})")
    private LayoutOverride layout = LayoutOverride.AUTO;

    @CommandLine.Option(names = "--x-threshold", paramLabel = "X", description = "Column split position in page points")
    private Double xThreshold;

    @CommandLine.Option(names = "--force-ocr", description = "OCR every page (image-only PDFs)")
    private boolean forceOcr;

    @CommandLine.Option(names = "--ocr-fallback", description = "OCR pages that have no text layer")
    private boolean ocrFallback;

    @CommandLine.Option(names = "--ocr-dpi", paramLabel = "DPI", description = "Rasterization resolution for OCR")
    private Integer ocrDpi;

    @CommandLine.Option(names = "--ocr-language", paramLabel = "LANG", description = "Tesseract language code")
    private String ocrLanguage;

    @CommandLine.Option(names = "--tessdata-path", paramLabel = "DIR", description = "Tesseract trained data directory")
    private String tessdataPath;

    @CommandLine.Option(names = "--tesseract-library-path", paramLabel = "DIR",
            description = "Directory holding the native tesseract library")
    private String tesseractLibraryPath;

    public File pdf() {
        return pdf;
    }

    public Path out() {
        return out;
    }

    public LayoutOverride layout() {
        return layout;
    }

    public Double xThreshold() {
        return xThreshold;
    }

    public boolean forceOcr() {
        return forceOcr;
    }

    public boolean ocrFallback() {
        return ocrFallback;
    }

    public Integer ocrDpi() {
        return ocrDpi;
    }

    public String ocrLanguage() {
        return ocrLanguage;
    }

    public String tessdataPath() {
        return tessdataPath;
    }

    public String tesseractLibraryPath() {
        return tesseractLibraryPath;
    }
}

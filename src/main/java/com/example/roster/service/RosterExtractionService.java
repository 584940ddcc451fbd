package com.example.roster.service;

import com.example.roster.dto.ExtractionRequest;
import com.example.roster.dto.ExtractionResult;
import com.example.roster.dto.layout.Token;
import com.example.roster.model.AttendeeRecord;
import com.example.roster.model.ExtractionStrategy;
import com.example.roster.model.LayoutMode;
import com.example.roster.model.LayoutOverride;
import com.example.roster.service.assembly.RecordAssembler;
import com.example.roster.service.layout.LayoutModeDetector;
import com.example.roster.service.ocr.TesseractFactory;
import com.example.roster.service.source.OcrWordSource;
import com.example.roster.service.source.TextLayerCharacterSource;
import com.example.roster.service.source.TextLayerWordSource;
import com.example.roster.service.source.TokenSource;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Document-level dispatch: picks the token source and record strategy for a PDF,
 * then walks its pages in order. A page that cannot be read is logged and skipped.
 */
@Service
public class RosterExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(RosterExtractionService.class);

    private final TextLayerCharacterSource characterSource;
    private final TextLayerWordSource wordSource;
    private final TesseractFactory tesseractFactory;
    private final LayoutModeDetector layoutModeDetector;
    private final Map<ExtractionStrategy, RecordAssembler> assemblers = new EnumMap<>(ExtractionStrategy.class);

    public RosterExtractionService(TextLayerCharacterSource characterSource,
                                   TextLayerWordSource wordSource,
                                   TesseractFactory tesseractFactory,
                                   LayoutModeDetector layoutModeDetector,
                                   List<RecordAssembler> recordAssemblers) {
        this.characterSource = characterSource;
        this.wordSource = wordSource;
        this.tesseractFactory = tesseractFactory;
        this.layoutModeDetector = layoutModeDetector;
        for (RecordAssembler assembler : recordAssemblers) {
            assemblers.put(assembler.strategy(), assembler);
        }
        for (ExtractionStrategy strategy : ExtractionStrategy.values()) {
            if (!assemblers.containsKey(strategy)) {
                throw new IllegalStateException("No record assembler registered for " + strategy);
            }
        }
    }

    /**
     * @throws IOException when the document itself cannot be opened
     */
    public ExtractionResult extract(ExtractionRequest request) throws IOException {
        File pdfFile = request.getPdfFile();
        if (pdfFile == null || !pdfFile.isFile()) {
            throw new IOException("PDF file not found: " + pdfFile);
        }
        logger.info("Extracting roster from {}", pdfFile.getName());

        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            return extract(document, request);
        }
    }

    public ExtractionResult extract(PDDocument document, ExtractionRequest request) {
        OcrWordSource ocrSource = request.needsOcr() ? createOcrSource(request) : null;

        TokenSource source;
        ExtractionStrategy strategy;
        LayoutMode mode;
        if (request.isForceOcr()) {
            source = ocrSource;
            strategy = ExtractionStrategy.TWO_COLUMN;
            mode = LayoutMode.TWO;
        } else {
            mode = resolveLayout(document, request);
            if (mode == LayoutMode.TWO) {
                source = wordSource;
                strategy = ExtractionStrategy.TWO_COLUMN;
            } else {
                source = characterSource;
                strategy = ExtractionStrategy.SINGLE_COLUMN;
            }
        }
        logger.info("Layout {} via {} ({} pages)", mode, source.describe(), document.getNumberOfPages());

        List<AttendeeRecord> records = new ArrayList<>();
        List<Integer> processed = new ArrayList<>();
        List<Integer> empty = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();

        for (int pageIndex = 0; pageIndex < document.getNumberOfPages(); pageIndex++) {
            int pageNumber = pageIndex + 1;
            try {
                List<Token> tokens = source.readPage(document, pageIndex);
                TokenSource pageSource = source;
                ExtractionStrategy pageStrategy = strategy;

                if (tokens.isEmpty() && ocrSource != null && source != ocrSource) {
                    logger.info("Page {} has no text layer, falling back to OCR", pageNumber);
                    tokens = ocrSource.readPage(document, pageIndex);
                    pageSource = ocrSource;
                    pageStrategy = ExtractionStrategy.TWO_COLUMN;
                }
                if (tokens.isEmpty()) {
                    logger.debug("Page {} yielded no tokens, skipping", pageNumber);
                    empty.add(pageNumber);
                    continue;
                }

                List<AttendeeRecord> pageRecords = assemblePage(tokens, pageSource, pageStrategy, request.getXThreshold());
                logger.debug("Page {}: {} records", pageNumber, pageRecords.size());
                records.addAll(pageRecords);
                processed.add(pageNumber);
            } catch (IOException | RuntimeException | LinkageError e) {
                // LinkageError: tess4j could not load the native tesseract library
                logger.warn("Skipping page {}: {}", pageNumber, e.toString());
                failed.add(pageNumber);
            }
        }

        logger.info("Extracted {} records from {} pages ({} empty, {} failed)",
                records.size(), processed.size(), empty.size(), failed.size());
        return new ExtractionResult(records, mode, request.isForceOcr(), processed, empty, failed);
    }

    public List<AttendeeRecord> assemblePage(List<Token> tokens, TokenSource source,
                                             ExtractionStrategy strategy, double xThreshold) {
        return assemblers.get(strategy).assemble(tokens, source.granularity(), xThreshold);
    }

    LayoutMode resolveLayout(PDDocument document, ExtractionRequest request) {
        LayoutOverride override = request.getLayout() == null ? LayoutOverride.AUTO : request.getLayout();
        switch (override) {
            case ONE:
                return LayoutMode.SINGLE;
            case TWO:
                return LayoutMode.TWO;
            default:
                return layoutModeDetector.detect(document, wordSource, request.getXThreshold());
        }
    }

    private OcrWordSource createOcrSource(ExtractionRequest request) {
        return new OcrWordSource(
                tesseractFactory.create(request.getTessdataPath(), request.getTesseractLibraryPath(), request.getOcrLanguage()),
                request.getOcrDpi());
    }
}

package com.example.roster.service.source;

import com.example.roster.dto.layout.Token;
import com.example.roster.model.TokenGranularity;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rasterizes a page and reads its words through Tesseract.
 * <p>
 * Pixel coordinates are scaled back to page points ({@code 72 / dpi}) so that the
 * column threshold and line tolerance keep their text-layer meaning.
 */
public class OcrWordSource implements TokenSource {

    private static final Logger logger = LoggerFactory.getLogger(OcrWordSource.class);

    private static final double POINTS_PER_INCH = 72.0;

    private final ITesseract tesseract;
    private final int dpi;

    public OcrWordSource(ITesseract tesseract, int dpi) {
        if (dpi <= 0) {
            throw new IllegalArgumentException("OCR dpi must be positive: " + dpi);
        }
        this.tesseract = tesseract;
        this.dpi = dpi;
    }

    @Override
    public TokenGranularity granularity() {
        return TokenGranularity.WORD;
    }

    @Override
    public List<Token> readPage(PDDocument document, int pageIndex) throws IOException {
        PDFRenderer renderer = new PDFRenderer(document);
        BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
        List<Word> words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        List<Token> tokens = toTokens(words);
        logger.debug("OCR page {}: {} words, {} kept", pageIndex + 1, words == null ? 0 : words.size(), tokens.size());
        return tokens;
    }

    /**
     * Drops blank words and words without a confidence score.
     */
    List<Token> toTokens(List<Word> words) {
        List<Token> tokens = new ArrayList<>();
        if (words == null) {
            return tokens;
        }
        double scale = POINTS_PER_INCH / dpi;
        for (Word word : words) {
            String text = word.getText() == null ? "" : word.getText().trim();
            if (text.isEmpty() || word.getConfidence() < 0) {
                continue;
            }
            Rectangle box = word.getBoundingBox();
            tokens.add(new Token(text, box.getX() * scale, box.getY() * scale));
        }
        return tokens;
    }

    @Override
    public String describe() {
        return "OcrWordSource(" + dpi + " dpi)";
    }
}

package com.example.roster.service.source;

import com.example.roster.dto.layout.Token;
import com.example.roster.model.TokenGranularity;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every glyph drawn on a page, explicit spaces included, with a bold flag
 * derived from the font name.
 */
@Component
public class TextLayerCharacterSource implements TokenSource {

    @Override
    public TokenGranularity granularity() {
        return TokenGranularity.CHARACTER;
    }

    @Override
    public List<Token> readPage(PDDocument document, int pageIndex) throws IOException {
        GlyphCollector collector = new GlyphCollector();
        collector.setStartPage(pageIndex + 1);
        collector.setEndPage(pageIndex + 1);
        collector.getText(document);
        return collector.glyphs;
    }

    static boolean isBoldFont(PDFont font) {
        if (font == null) {
            return false;
        }
        String name = font.getName();
        return name != null && name.contains("Bold");
    }

    private static final class GlyphCollector extends PDFTextStripper {

        private final List<Token> glyphs = new ArrayList<>();

        GlyphCollector() throws IOException {
            super();
        }

        @Override
        protected void processTextPosition(TextPosition text) {
            super.processTextPosition(text);
            String unicode = text.getUnicode();
            if (unicode == null || unicode.isEmpty()) {
                return;
            }
            double top = text.getYDirAdj() - text.getHeightDir();
            glyphs.add(new Token(unicode, text.getXDirAdj(), top, isBoldFont(text.getFont())));
        }
    }
}

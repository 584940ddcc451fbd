package com.example.roster.service.source;

import com.example.roster.dto.layout.Token;
import com.example.roster.model.TokenGranularity;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads whitespace-delimited words from the text layer. Carries no font weight.
 */
@Component
public class TextLayerWordSource implements TokenSource {

    @Override
    public TokenGranularity granularity() {
        return TokenGranularity.WORD;
    }

    @Override
    public List<Token> readPage(PDDocument document, int pageIndex) throws IOException {
        WordCollector collector = new WordCollector();
        collector.setSortByPosition(true);
        collector.setStartPage(pageIndex + 1);
        collector.setEndPage(pageIndex + 1);
        collector.getText(document);
        return collector.words;
    }

    private static final class WordCollector extends PDFTextStripper {

        private final List<Token> words = new ArrayList<>();

        WordCollector() throws IOException {
            super();
        }

        @Override
        protected void writeString(String string, List<TextPosition> textPositions) throws IOException {
            super.writeString(string, textPositions);
            if (textPositions == null || textPositions.isEmpty()) {
                return;
            }
            // a stripper "word" may still contain explicit space glyphs
            StringBuilder word = new StringBuilder();
            double x0 = 0.0;
            double top = Double.MAX_VALUE;
            for (TextPosition position : textPositions) {
                String unicode = position.getUnicode();
                if (unicode == null || unicode.isBlank()) {
                    flush(word, x0, top);
                    word.setLength(0);
                    top = Double.MAX_VALUE;
                    continue;
                }
                if (word.length() == 0) {
                    x0 = position.getXDirAdj();
                }
                word.append(unicode);
                top = Math.min(top, position.getYDirAdj() - position.getHeightDir());
            }
            flush(word, x0, top);
        }

        private void flush(StringBuilder word, double x0, double top) {
            if (word.length() > 0) {
                words.add(new Token(word.toString(), x0, top));
            }
        }
    }
}

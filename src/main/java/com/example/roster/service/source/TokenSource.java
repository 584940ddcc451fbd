package com.example.roster.service.source;

import com.example.roster.dto.layout.Token;
import com.example.roster.model.TokenGranularity;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.util.List;

/**
 * Produces the positioned tokens of one page.
 */
public interface TokenSource {

    TokenGranularity granularity();

    /**
     * @param pageIndex 0-based page index
     * @return tokens of the page, empty when the page carries no text
     * @throws IOException when the page cannot be read
     */
    List<Token> readPage(PDDocument document, int pageIndex) throws IOException;

    default String describe() {
        return getClass().getSimpleName();
    }
}

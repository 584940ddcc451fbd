package com.example.roster.service.layout;

import com.example.roster.dto.layout.Token;
import com.example.roster.model.LayoutMode;
import com.example.roster.service.source.TokenSource;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LayoutModeDetectorTest {

    private static final double THRESHOLD = 260.0;

    private final LayoutModeDetector detector = new LayoutModeDetector(2, 0.25);

    @Test
    void balancedColumnsMeanTwoColumnLayout() {
        List<Token> page = page(40, 35);

        assertThat(detector.isTwoColumnPage(page, THRESHOLD)).isTrue();
    }

    @Test
    void lopsidedPageStaysSingleColumn() {
        assertThat(detector.isTwoColumnPage(page(95, 5), THRESHOLD)).isFalse();
    }

    @Test
    void quarterShareOnEachSideIsEnough() {
        assertThat(detector.isTwoColumnPage(page(75, 25), THRESHOLD)).isTrue();
        assertThat(detector.isTwoColumnPage(page(76, 24), THRESHOLD)).isFalse();
    }

    @Test
    void tokenOnThresholdCountsAsRightColumn() {
        List<Token> page = List.of(new Token("a", 10, 0), new Token("b", THRESHOLD, 0));

        assertThat(detector.isTwoColumnPage(page, THRESHOLD)).isTrue();
    }

    @Test
    void emptyPagesNeverQualify() throws IOException {
        TokenSource source = mock(TokenSource.class);
        when(source.readPage(any(PDDocument.class), anyInt())).thenReturn(List.of());

        assertThat(detector.isTwoColumnPage(List.of(), THRESHOLD)).isFalse();
        assertThat(detector.isTwoColumnPage(null, THRESHOLD)).isFalse();
        try (PDDocument document = document(2)) {
            assertThat(detector.detect(document, source, THRESHOLD)).isEqualTo(LayoutMode.SINGLE);
        }
        try (PDDocument document = document(0)) {
            assertThat(detector.detect(document, source, THRESHOLD)).isEqualTo(LayoutMode.SINGLE);
        }
    }

    @Test
    void secondSampledPageCanDecide() throws IOException {
        TokenSource source = mock(TokenSource.class);
        when(source.readPage(any(PDDocument.class), eq(0))).thenReturn(page(10, 0));
        when(source.readPage(any(PDDocument.class), eq(1))).thenReturn(page(20, 20));

        try (PDDocument document = document(2)) {
            assertThat(detector.detect(document, source, THRESHOLD)).isEqualTo(LayoutMode.TWO);
        }
    }

    @Test
    void pagesBeyondSampleAreNeverRead() throws IOException {
        TokenSource source = mock(TokenSource.class);
        when(source.readPage(any(PDDocument.class), eq(0))).thenReturn(page(10, 0));
        when(source.readPage(any(PDDocument.class), eq(1))).thenReturn(page(10, 0));
        when(source.readPage(any(PDDocument.class), eq(2))).thenReturn(page(20, 20));

        try (PDDocument document = document(3)) {
            assertThat(detector.detect(document, source, THRESHOLD)).isEqualTo(LayoutMode.SINGLE);
            verify(source, never()).readPage(any(PDDocument.class), eq(2));
        }
    }

    @Test
    void firstQualifyingPageStopsSampling() throws IOException {
        TokenSource source = mock(TokenSource.class);
        when(source.readPage(any(PDDocument.class), eq(0))).thenReturn(page(40, 35));

        try (PDDocument document = document(2)) {
            assertThat(detector.detect(document, source, THRESHOLD)).isEqualTo(LayoutMode.TWO);
            verify(source, never()).readPage(any(PDDocument.class), eq(1));
        }
    }

    @Test
    void unreadablePageIsSkipped() throws IOException {
        TokenSource source = mock(TokenSource.class);
        when(source.readPage(any(PDDocument.class), eq(0))).thenThrow(new IOException("damaged content stream"));
        when(source.readPage(any(PDDocument.class), eq(1))).thenReturn(page(8, 7));

        try (PDDocument document = document(3)) {
            assertThat(detector.detect(document, source, THRESHOLD)).isEqualTo(LayoutMode.TWO);
            verify(source, never()).readPage(any(PDDocument.class), eq(2));
        }
    }

    @Test
    void allPagesUnreadableFallsBackToSingleColumn() throws IOException {
        TokenSource source = mock(TokenSource.class);
        when(source.readPage(any(PDDocument.class), anyInt())).thenThrow(new IllegalStateException("bad font"));

        try (PDDocument document = document(2)) {
            assertThat(detector.detect(document, source, THRESHOLD)).isEqualTo(LayoutMode.SINGLE);
        }
    }

    private static List<Token> page(int left, int right) {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < left; i++) {
            tokens.add(new Token("l" + i, 50, i * 12));
        }
        for (int i = 0; i < right; i++) {
            tokens.add(new Token("r" + i, 320, i * 12));
        }
        return tokens;
    }

    private static PDDocument document(int pages) {
        PDDocument document = new PDDocument();
        for (int i = 0; i < pages; i++) {
            document.addPage(new PDPage());
        }
        return document;
    }
}

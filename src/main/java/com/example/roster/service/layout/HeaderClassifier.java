package com.example.roster.service.layout;

import com.example.roster.dto.layout.Header;
import com.example.roster.dto.layout.Paragraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recognises delegation headers by shape: a single line made only of uppercase
 * letters, spaces and slashes, e.g. {@code "SWITZERLAND / SUISSE / SUIZA"}.
 */
@Component
public class HeaderClassifier {

    public boolean isHeaderText(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (!Character.isUpperCase(c) && c != ' ' && c != '/') {
                return false;
            }
        }
        return true;
    }

    public boolean isHeader(Paragraph paragraph) {
        return paragraph.isSingleLine() && isHeaderText(paragraph.firstLine());
    }

    /**
     * Text before the first slash, so multilingual variants collapse to the first one.
     */
    public static String sectionName(String text) {
        if (text == null) {
            return "";
        }
        int slash = text.indexOf('/');
        return (slash < 0 ? text : text.substring(0, slash)).trim();
    }

    /**
     * Headers among the given paragraphs, ordered by midpoint.
     */
    public List<Header> detectHeaders(List<Paragraph> paragraphs) {
        List<Header> headers = new ArrayList<>();
        for (Paragraph paragraph : paragraphs) {
            if (isHeader(paragraph)) {
                headers.add(new Header(sectionName(paragraph.firstLine()), paragraph.getMidY()));
            }
        }
        headers.sort(Comparator.comparingDouble(Header::getMidY));
        return headers;
    }

    /**
     * Name of the last header at or above {@code midY}, or an empty string when the
     * position precedes every header of the page.
     */
    public String delegationAt(double midY, List<Header> sortedHeaders) {
        String active = "";
        for (Header header : sortedHeaders) {
            if (header.getMidY() <= midY) {
                active = header.getName();
            } else {
                break;
            }
        }
        return active;
    }
}

package com.example.roster.dto.layout;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A positioned unit of page text, either one glyph or one word.
 * Coordinates are in page points with the origin at the upper left corner.
 */
@Value
@AllArgsConstructor
public class Token {
    String text;
    double x0;
    double top;
    boolean bold; // only known for glyphs read from the text layer

    public Token(String text, double x0, double top) {
        this(text, x0, top, false);
    }
}

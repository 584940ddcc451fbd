package com.example.roster.dto.layout;

import lombok.Value;

/**
 * A run of tokens sharing one vertical position. Only the top coordinate of the
 * member tokens is tracked: y0 is the smallest, y1 the largest.
 */
@Value
public class Line {
    String text;
    double y0;
    double y1;
    boolean bold;

    public double getMidY() {
        return (y0 + y1) / 2.0;
    }

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}

package com.example.roster.dto.layout;

import lombok.Value;

import java.util.List;

@Value
public class Paragraph {
    List<String> lines;
    double y0;
    double y1;

    public Paragraph(List<String> lines, double y0, double y1) {
        this.lines = List.copyOf(lines);
        this.y0 = y0;
        this.y1 = y1;
    }

    public double getMidY() {
        return (y0 + y1) / 2.0;
    }

    public boolean isSingleLine() {
        return lines.size() == 1;
    }

    public String firstLine() {
        return lines.isEmpty() ? "" : lines.get(0);
    }
}

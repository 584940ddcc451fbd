package com.example.roster.service.layout;

import com.example.roster.dto.layout.Line;
import com.example.roster.dto.layout.Token;
import com.example.roster.model.TokenGranularity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups positioned tokens into lines by vertical proximity.
 * <p>
 * Tokens are scanned in (top, x0) order. A token joins the open line while its top
 * stays within {@code yTolerance} of the last top accepted into that line, so a
 * line may drift slowly downwards across a long row of glyphs. Each closed line is
 * re-sorted left to right before its text is rebuilt.
 */
@Component
public class LineClusterer {

    static final Comparator<Token> READING_ORDER =
            Comparator.comparingDouble(Token::getTop).thenComparingDouble(Token::getX0);

    private final double yTolerance;

    public LineClusterer(@Value("${roster.line.y-tolerance:3.0}") double yTolerance) {
        this.yTolerance = yTolerance;
    }

    public List<Line> cluster(List<Token> tokens, TokenGranularity granularity) {
        List<Line> lines = new ArrayList<>();
        if (tokens == null || tokens.isEmpty()) {
            return lines;
        }

        List<Token> sorted = new ArrayList<>(tokens);
        sorted.sort(READING_ORDER);

        List<Token> current = new ArrayList<>();
        current.add(sorted.get(0));
        double y0 = sorted.get(0).getTop();
        double y1 = y0;

        for (int i = 1; i < sorted.size(); i++) {
            Token token = sorted.get(i);
            if (Math.abs(token.getTop() - y1) <= yTolerance) {
                current.add(token);
                y1 = token.getTop();
            } else {
                lines.add(close(current, y0, y1, granularity));
                current = new ArrayList<>();
                current.add(token);
                y0 = token.getTop();
                y1 = y0;
            }
        }
        lines.add(close(current, y0, y1, granularity));
        return lines;
    }

    public double getYTolerance() {
        return yTolerance;
    }

    private Line close(List<Token> members, double y0, double y1, TokenGranularity granularity) {
        members.sort(Comparator.comparingDouble(Token::getX0));
        StringBuilder text = new StringBuilder();
        boolean bold = false;
        for (Token token : members) {
            if (text.length() > 0) {
                text.append(granularity.separator());
            }
            text.append(token.getText() == null ? "" : token.getText());
            bold |= token.isBold();
        }
        return new Line(text.toString().trim(), y0, y1, bold);
    }
}

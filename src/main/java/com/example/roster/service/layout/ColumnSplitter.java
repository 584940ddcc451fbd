package com.example.roster.service.layout;

import com.example.roster.dto.layout.Token;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ColumnSplitter {

    /**
     * Splits a page at {@code xThreshold}: tokens starting left of it go to the
     * first stream, the rest to the second. Both streams come back in (top, x0) order.
     */
    public List<List<Token>> split(List<Token> tokens, double xThreshold) {
        List<Token> left = new ArrayList<>();
        List<Token> right = new ArrayList<>();
        for (Token token : tokens) {
            if (token.getX0() < xThreshold) {
                left.add(token);
            } else {
                right.add(token);
            }
        }
        left.sort(LineClusterer.READING_ORDER);
        right.sort(LineClusterer.READING_ORDER);
        return List.of(left, right);
    }
}

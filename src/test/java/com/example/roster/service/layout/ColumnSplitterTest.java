package com.example.roster.service.layout;

import com.example.roster.dto.layout.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnSplitterTest {

    private final ColumnSplitter splitter = new ColumnSplitter();

    @Test
    void splitsAtThresholdAndSortsEachStream() {
        List<Token> tokens = List.of(
                new Token("R2", 400, 30),
                new Token("L2", 50, 30),
                new Token("edge", 260, 10),
                new Token("L1b", 90, 10),
                new Token("L1a", 40, 10));

        List<List<Token>> columns = splitter.split(tokens, 260.0);

        assertThat(columns).hasSize(2);
        assertThat(columns.get(0)).extracting(Token::getText).containsExactly("L1a", "L1b", "L2");
        assertThat(columns.get(1)).extracting(Token::getText).containsExactly("edge", "R2");
    }

    @Test
    void emptyPageGivesTwoEmptyStreams() {
        List<List<Token>> columns = splitter.split(List.of(), 260.0);

        assertThat(columns).hasSize(2).allSatisfy(column -> assertThat(column).isEmpty());
    }
}

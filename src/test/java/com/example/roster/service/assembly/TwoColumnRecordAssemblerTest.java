package com.example.roster.service.assembly;

import com.example.roster.dto.layout.Header;
import com.example.roster.dto.layout.Paragraph;
import com.example.roster.dto.layout.Token;
import com.example.roster.model.AttendeeRecord;
import com.example.roster.model.TokenGranularity;
import com.example.roster.service.layout.ColumnSplitter;
import com.example.roster.service.layout.HeaderClassifier;
import com.example.roster.service.layout.HonorificParser;
import com.example.roster.service.layout.LineClusterer;
import com.example.roster.service.layout.ParagraphSegmenter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.roster.TestTokens.concat;
import static com.example.roster.TestTokens.words;
import static org.assertj.core.api.Assertions.assertThat;

class TwoColumnRecordAssemblerTest {

    private final TwoColumnRecordAssembler assembler = new TwoColumnRecordAssembler(
            new ColumnSplitter(),
            new LineClusterer(3.0),
            new ParagraphSegmenter(1.5),
            new HeaderClassifier(),
            new HonorificParser("honorifics.txt"));

    @Test
    void paragraphBelowHeaderBecomesRecord() {
        List<AttendeeRecord> records = assembler.assembleColumns(
                List.of(new Header("ARGENTINA", 10)),
                List.of(List.of(new Paragraph(List.of("Jane Roe", "Dept. of Wildlife"), 35, 45)), List.of()));

        assertThat(records).containsExactly(new AttendeeRecord("ARGENTINA", "", "Jane Roe", "Dept. of Wildlife"));
    }

    @Test
    void paragraphAboveEveryHeaderHasNoDelegation() {
        List<AttendeeRecord> records = assembler.assembleColumns(
                List.of(new Header("ARGENTINA", 100)),
                List.of(List.of(new Paragraph(List.of("Ms. Early Bird"), 20, 20))));

        assertThat(records).containsExactly(new AttendeeRecord("", "Ms.", "Early Bird", ""));
    }

    @Test
    void headerParagraphsAreNotPeople() {
        List<AttendeeRecord> records = assembler.assembleColumns(
                List.of(new Header("CHILE", 10)),
                List.of(List.of(
                        new Paragraph(List.of("CHILE"), 10, 10),
                        new Paragraph(List.of("Dr. Ana Ruiz", "CONAF", "Santiago"), 30, 54))));

        assertThat(records).containsExactly(new AttendeeRecord("CHILE", "Dr.", "Ana Ruiz", "CONAF Santiago"));
    }

    @Test
    void leftColumnIsReadBeforeRightColumn() {
        List<Token> page = concat(
                words("ARGENTINA", 40, 10),
                words("Mr. John Doe", 40, 40),
                words("Ministry of Environment", 40, 52),
                words("Buenos Aires", 40, 64),
                words("BRAZIL / BRESIL", 40, 100),
                words("Ms. Ann Lee", 40, 130),
                words("Dept. of Wildlife", 40, 142),
                words("Brasilia", 40, 154),
                words("Dr. Raj Patel", 300, 40),
                words("University of Delhi", 300, 52),
                words("Sr. Luis Silva", 300, 130),
                words("IBAMA", 300, 142));

        List<AttendeeRecord> records = assembler.assemble(page, TokenGranularity.WORD, 260.0);

        assertThat(records).containsExactly(
                new AttendeeRecord("ARGENTINA", "Mr.", "John Doe", "Ministry of Environment Buenos Aires"),
                new AttendeeRecord("BRAZIL", "Ms.", "Ann Lee", "Dept. of Wildlife Brasilia"),
                new AttendeeRecord("ARGENTINA", "Dr.", "Raj Patel", "University of Delhi"),
                new AttendeeRecord("BRAZIL", "Sr.", "Luis Silva", "IBAMA"));
    }

    @Test
    void emptyPageGivesNoRecords() {
        assertThat(assembler.assemble(List.of(), TokenGranularity.WORD, 260.0)).isEmpty();
    }
}

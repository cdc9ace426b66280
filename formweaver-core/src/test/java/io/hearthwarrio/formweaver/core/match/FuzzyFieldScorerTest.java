package io.hearthwarrio.formweaver.core.match;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.TableContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FuzzyFieldScorerTest {

    private final FuzzyFieldScorer scorer = new FuzzyFieldScorer();

    private static ElementFingerprint labelled(String label) {
        return ElementFingerprint.builder().label(label).build();
    }

    @Test
    void identicalLabelScoresHundred() {
        assertEquals(100, scorer.score("用户名", labelled("用户名")));
    }

    @Test
    void separatorsAndCaseAreIgnored() {
        assertEquals(100, scorer.score("user_name", labelled("User Name:")));
        assertEquals(100, scorer.score("数量：", labelled("数量")));
    }

    @Test
    void tokenOverlapScoresSeventy() {
        int score = scorer.score("User Name", labelled("Name User"));

        assertTrue(score >= 70 && score < 100, "score was " + score);
    }

    @Test
    void unrelatedLabelScoresZero() {
        assertEquals(0, scorer.score("用户名", labelled("Address")));
    }

    @Test
    void containmentScoresEighty() {
        assertEquals(80, scorer.scoreText("Phone", "Mobile phone number"));
    }

    @Test
    void partialTokenOverlapScoresBetweenFortyAndSeventy() {
        assertEquals(55, scorer.scoreText("order date", "delivery date"));
    }

    @Test
    void matchingInitialsOfTwoMultiWordTextsScoreSixty() {
        assertEquals(60, scorer.scoreText("Unit Price", "Usage Period"));
        assertEquals(60, scorer.scoreText("First Name", "Family Name"));
    }

    @Test
    void abbreviationAloneDoesNotMatchInitials() {
        assertEquals(0, scorer.scoreText("fn", "First Name"));
        assertEquals(0, scorer.scoreText("vat", "Value Added Tax"));
    }

    @Test
    void columnHeaderAndIdAreCandidates() {
        ElementFingerprint cell = ElementFingerprint.builder()
                .table(new TableContext(0, 1, "", "Quantity"))
                .id("qty_1")
                .build();

        assertEquals(100, scorer.score("quantity", cell));
        assertEquals(80, scorer.score("qty", cell));
    }

    @Test
    void blankFieldScoresZero() {
        assertEquals(0, scorer.score("  ", labelled("Name")));
    }
}

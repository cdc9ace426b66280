package io.hearthwarrio.formweaver.core.progress;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AnchorValuesTest {

    @Test
    void spreadsheetNumbersMatchPageIntegers() {
        assertTrue(AnchorValues.matches("100.0", "100"));
        assertTrue(AnchorValues.matches(" 42 ", "42.00"));
    }

    @Test
    void textMustMatchExactlyAfterTrim() {
        assertTrue(AnchorValues.matches(" A-100 ", "A-100"));
        assertFalse(AnchorValues.matches("A-100", "a-100"));
        assertFalse(AnchorValues.matches("100", "1000"));
    }

    @Test
    void nullsNeverMatch() {
        assertFalse(AnchorValues.matches(null, "1"));
        assertFalse(AnchorValues.matches("1", null));
    }
}

package io.hearthwarrio.formweaver.core.progress;

import java.math.BigDecimal;

/**
 * Tolerant comparison of anchor (key column) values.
 * <p>
 * Spreadsheets often hand over numbers as {@code 100.0} while the page shows {@code 100}.
 */
public final class AnchorValues {

    private AnchorValues() {
        // utility class
    }

    /**
     * @return true when both trimmed values are equal, or both parse as the same number
     */
    public static boolean matches(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        String ta = a.trim();
        String tb = b.trim();
        if (ta.equals(tb)) {
            return true;
        }
        BigDecimal na = parse(ta);
        BigDecimal nb = parse(tb);
        return na != null && nb != null && na.compareTo(nb) == 0;
    }

    private static BigDecimal parse(String s) {
        if (s.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

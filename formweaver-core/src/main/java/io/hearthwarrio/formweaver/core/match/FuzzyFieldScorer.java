package io.hearthwarrio.formweaver.core.match;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Default {@link FieldScorer}.
 * <p>
 * The field name is compared with every text anchor of the control (label, form label, aria-label,
 * column header, name, placeholder, id) and the best score wins:
 * <ul>
 *   <li>100: normalized texts are equal</li>
 *   <li>80: one normalized text contains the other</li>
 *   <li>40..70: token overlap, {@code 40 + 30 * common / max(tokensA, tokensB)}</li>
 *   <li>60: both texts are multi-word and share the same initials</li>
 * </ul>
 */
public final class FuzzyFieldScorer implements FieldScorer {

    public static final int EXACT = 100;
    public static final int CONTAINS = 80;
    public static final int INITIALS = 60;
    private static final int OVERLAP_BASE = 40;
    private static final int OVERLAP_SPAN = 30;

    @Override
    public int score(String fieldName, ElementFingerprint fingerprint) {
        if (fieldName == null || fieldName.isBlank() || fingerprint == null) {
            return 0;
        }
        int best = 0;
        for (String text : candidateTexts(fingerprint)) {
            best = Math.max(best, scoreText(fieldName, text));
            if (best == EXACT) {
                break;
            }
        }
        return best;
    }

    /**
     * Scores two plain texts.
     */
    public int scoreText(String a, String b) {
        String na = TextNormalizer.normalize(a);
        String nb = TextNormalizer.normalize(b);
        if (na.isEmpty() || nb.isEmpty()) {
            return 0;
        }
        if (na.equals(nb)) {
            return EXACT;
        }
        if (na.contains(nb) || nb.contains(na)) {
            return CONTAINS;
        }

        List<String> ta = TextNormalizer.tokens(a);
        List<String> tb = TextNormalizer.tokens(b);
        int best = 0;

        Set<String> common = new HashSet<>(ta);
        common.retainAll(new HashSet<>(tb));
        if (!common.isEmpty()) {
            int longest = Math.max(ta.size(), tb.size());
            best = OVERLAP_BASE + (OVERLAP_SPAN * common.size()) / longest;
        }

        String ia = TextNormalizer.initials(ta);
        String ib = TextNormalizer.initials(tb);
        if (!ia.isEmpty() && ia.equals(ib)) {
            best = Math.max(best, INITIALS);
        }
        return best;
    }

    private static List<String> candidateTexts(ElementFingerprint fp) {
        List<String> texts = new ArrayList<>(7);
        addIfPresent(texts, fp.getLabel());
        addIfPresent(texts, fp.getFormLabel());
        addIfPresent(texts, fp.getAriaLabel());
        fp.getTable().ifPresent(t -> addIfPresent(texts, t.getColumnHeader()));
        addIfPresent(texts, fp.getName());
        addIfPresent(texts, fp.getPlaceholder());
        addIfPresent(texts, fp.getId());
        return texts;
    }

    private static void addIfPresent(List<String> texts, String s) {
        if (s != null && !s.isBlank()) {
            texts.add(s);
        }
    }
}

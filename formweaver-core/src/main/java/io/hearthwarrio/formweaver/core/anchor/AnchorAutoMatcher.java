package io.hearthwarrio.formweaver.core.anchor;

import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.browser.WebColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds an {@link AnchorConfig} from source field names and the columns of the page table.
 * <p>
 * Read-only columns are anchor candidates, input columns are fill targets. Pairs are made by name similarity:
 * <ul>
 *   <li>1.0 for equal names (case-insensitive, trimmed)</li>
 *   <li>0.9 when one contains the other</li>
 *   <li>otherwise the Ratcliff/Obershelp ratio {@code 2 * matches / (len(a) + len(b))}</li>
 * </ul>
 * The best-scoring source field becomes the primary anchor; further read-only matches are auxiliaries.
 */
public final class AnchorAutoMatcher {

    public static final double DEFAULT_THRESHOLD = 0.6;

    /**
     * Field names that never make good keys.
     */
    static final List<String> NOT_ANCHOR_KEYWORDS = List.of(
            "操作", "选择", "序号", "编号", "action", "select", "index", "备注", "remark", "note", "说明"
    );

    /**
     * Field names that describe the row rather than values to enter.
     */
    static final List<String> NOT_FILL_KEYWORDS = List.of(
            "编码", "名称", "规格", "单位", "厂家", "科室", "code", "name", "spec", "unit", "manufacturer"
    );

    private final double threshold;
    private final FillLogSink log;

    public AnchorAutoMatcher(FillLogSink log) {
        this(DEFAULT_THRESHOLD, log);
    }

    public AnchorAutoMatcher(double threshold, FillLogSink log) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within (0, 1]");
        }
        this.threshold = threshold;
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    public AnchorConfig autoMatch(List<String> sourceFields, List<WebColumn> columns) {
        Objects.requireNonNull(sourceFields, "sourceFields must not be null");
        Objects.requireNonNull(columns, "columns must not be null");

        List<WebColumn> readOnly = new ArrayList<>();
        List<WebColumn> inputs = new ArrayList<>();
        for (WebColumn c : columns) {
            if (c.isReadOnly()) {
                readOnly.add(c);
            }
            if (c.isInput()) {
                inputs.add(c);
            }
        }

        List<AnchorPair> anchorPairs = new ArrayList<>();
        double total = 0.0;
        int count = 0;

        for (String field : sourceFields) {
            if (containsAny(field, NOT_ANCHOR_KEYWORDS)) {
                continue;
            }
            WebColumn best = null;
            double bestScore = 0.0;
            for (WebColumn c : readOnly) {
                double s = similarity(field, c.getLabel());
                if (s > bestScore && s >= threshold) {
                    bestScore = s;
                    best = c;
                }
            }
            if (best != null) {
                anchorPairs.add(new AnchorPair(field, best.getXpath(), best.getLabel(), true, bestScore));
                total += bestScore;
                count++;
            }
        }

        AnchorConfig config = new AnchorConfig();
        anchorPairs.sort((a, b) -> Double.compare(b.getSimilarity(), a.getSimilarity()));
        for (int i = 0; i < anchorPairs.size(); i++) {
            if (i == 0) {
                config.addAnchor(anchorPairs.get(i));
            } else {
                config.addAuxiliary(anchorPairs.get(i));
            }
        }

        for (String field : sourceFields) {
            if (isAnchorField(anchorPairs, field) || containsAny(field, NOT_FILL_KEYWORDS)) {
                continue;
            }
            WebColumn best = null;
            double bestScore = 0.0;
            for (WebColumn c : inputs) {
                double s = similarity(field, c.getLabel());
                if (s > bestScore && s >= threshold) {
                    bestScore = s;
                    best = c;
                }
            }
            if (best != null) {
                config.addFillMapping(field, best.getLabel());
                total += bestScore;
                count++;
            }
        }

        config.markAutoMatched(count == 0 ? 0.0 : (total / count) * 100.0);
        log.info("Anchor auto-match: " + anchorPairs.size() + " anchor column(s), "
                + config.getFillMappings().size() + " fill column(s), confidence "
                + Math.round(config.getConfidence()) + "%");
        return config;
    }

    static double similarity(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            return 0.0;
        }
        String s1 = a.trim().toLowerCase(Locale.ROOT);
        String s2 = b.trim().toLowerCase(Locale.ROOT);
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.contains(s2) || s2.contains(s1)) {
            return 0.9;
        }
        return 2.0 * matchingCharacters(s1, s2) / (s1.length() + s2.length());
    }

    /**
     * Ratcliff/Obershelp: longest common block, then recurse on both sides of it.
     */
    private static int matchingCharacters(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int bestLen = 0;
        int bestA = 0;
        int bestB = 0;
        int[] prev = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            int[] cur = new int[b.length() + 1];
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    cur[j] = prev[j - 1] + 1;
                    if (cur[j] > bestLen) {
                        bestLen = cur[j];
                        bestA = i - bestLen;
                        bestB = j - bestLen;
                    }
                }
            }
            prev = cur;
        }
        if (bestLen == 0) {
            return 0;
        }
        return bestLen
                + matchingCharacters(a.substring(0, bestA), b.substring(0, bestB))
                + matchingCharacters(a.substring(bestA + bestLen), b.substring(bestB + bestLen));
    }

    private static boolean isAnchorField(List<AnchorPair> pairs, String field) {
        for (AnchorPair p : pairs) {
            if (p.getSourceField().equals(field)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String field, List<String> keywords) {
        String lower = field == null ? "" : field.toLowerCase(Locale.ROOT);
        for (String k : keywords) {
            if (lower.contains(k)) {
                return true;
            }
        }
        return false;
    }
}

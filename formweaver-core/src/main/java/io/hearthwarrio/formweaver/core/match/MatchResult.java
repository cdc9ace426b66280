package io.hearthwarrio.formweaver.core.match;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one matching pass.
 */
public final class MatchResult {

    private final List<FieldMatch> matches;
    private final List<String> unmatchedFields;
    private final List<ElementFingerprint> unmatchedFingerprints;
    private final int suggestionThreshold;

    public MatchResult(
            List<FieldMatch> matches,
            List<String> unmatchedFields,
            List<ElementFingerprint> unmatchedFingerprints,
            int suggestionThreshold
    ) {
        this.matches = List.copyOf(matches);
        this.unmatchedFields = List.copyOf(unmatchedFields);
        this.unmatchedFingerprints = List.copyOf(unmatchedFingerprints);
        this.suggestionThreshold = suggestionThreshold;
    }

    public List<FieldMatch> getMatches() {
        return matches;
    }

    public List<String> getUnmatchedFields() {
        return unmatchedFields;
    }

    /**
     * Controls no field claimed, deduplicated by base label.
     */
    public List<ElementFingerprint> getUnmatchedFingerprints() {
        return unmatchedFingerprints;
    }

    /**
     * Field name to control, in field order.
     */
    public Map<String, ElementFingerprint> mappings() {
        Map<String, ElementFingerprint> out = new LinkedHashMap<>();
        for (FieldMatch m : matches) {
            out.put(m.getFieldName(), m.getFingerprint());
        }
        return out;
    }

    /**
     * High-confidence matches that can be applied without review.
     */
    public Map<String, ElementFingerprint> suggestions() {
        Map<String, ElementFingerprint> out = new LinkedHashMap<>();
        for (FieldMatch m : matches) {
            if (m.getScore() >= suggestionThreshold) {
                out.put(m.getFieldName(), m.getFingerprint());
            }
        }
        return out;
    }

    public int getMatchedCount() {
        return matches.size();
    }

    @Override
    public String toString() {
        return "MatchResult{" +
                "matched=" + matches.size() +
                ", unmatchedFields=" + unmatchedFields +
                ", unmatchedControls=" + unmatchedFingerprints.size() +
                '}';
    }
}

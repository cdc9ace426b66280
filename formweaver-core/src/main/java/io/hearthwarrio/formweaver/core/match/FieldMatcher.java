package io.hearthwarrio.formweaver.core.match;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy field-to-control matcher.
 * <p>
 * Fields are processed in the given order. Each one claims its best-scoring control that no earlier field
 * claimed, provided the score reaches the threshold. Ties go to the control scanned first.
 */
public final class FieldMatcher {

    private final FieldScorer scorer;
    private final MatchSettings settings;
    private final FingerprintDeduplicator deduplicator = new FingerprintDeduplicator();

    public FieldMatcher() {
        this(new FuzzyFieldScorer(), MatchSettings.defaults());
    }

    public FieldMatcher(FieldScorer scorer, MatchSettings settings) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public MatchResult match(List<String> fieldNames, List<ElementFingerprint> fingerprints) {
        Objects.requireNonNull(fieldNames, "fieldNames must not be null");
        Objects.requireNonNull(fingerprints, "fingerprints must not be null");

        boolean[] claimed = new boolean[fingerprints.size()];
        List<FieldMatch> matches = new ArrayList<>();
        List<String> unmatchedFields = new ArrayList<>();

        for (String field : fieldNames) {
            if (field == null || field.isBlank()) {
                continue;
            }
            int bestIndex = -1;
            int bestScore = -1;
            for (int i = 0; i < fingerprints.size(); i++) {
                if (claimed[i]) {
                    continue;
                }
                int s = scorer.score(field, fingerprints.get(i));
                if (s > bestScore) {
                    bestScore = s;
                    bestIndex = i;
                }
            }
            if (bestIndex >= 0 && bestScore >= settings.getThreshold()) {
                claimed[bestIndex] = true;
                matches.add(new FieldMatch(field, fingerprints.get(bestIndex), bestScore));
            } else {
                unmatchedFields.add(field);
            }
        }

        List<ElementFingerprint> claimedList = new ArrayList<>();
        List<ElementFingerprint> unclaimedList = new ArrayList<>();
        for (int i = 0; i < fingerprints.size(); i++) {
            (claimed[i] ? claimedList : unclaimedList).add(fingerprints.get(i));
        }

        return new MatchResult(
                matches,
                unmatchedFields,
                deduplicator.deduplicate(claimedList, unclaimedList),
                settings.getSuggestionThreshold()
        );
    }
}

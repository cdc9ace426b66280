package io.hearthwarrio.formweaver.core.match;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

/**
 * Scores how well a source field name describes a control, from 0 (unrelated) to 100 (same text).
 */
@FunctionalInterface
public interface FieldScorer {
    int score(String fieldName, ElementFingerprint fingerprint);
}

package io.hearthwarrio.formweaver.core.match;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.Objects;

/**
 * A source field paired with the control it was matched to.
 */
public final class FieldMatch {

    private final String fieldName;
    private final ElementFingerprint fingerprint;
    private final int score;

    public FieldMatch(String fieldName, ElementFingerprint fingerprint, int score) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        this.score = score;
    }

    public String getFieldName() {
        return fieldName;
    }

    public ElementFingerprint getFingerprint() {
        return fingerprint;
    }

    public int getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "FieldMatch{" +
                "field='" + fieldName + '\'' +
                ", score=" + score +
                ", control=" + fingerprint.displayName() +
                '}';
    }
}

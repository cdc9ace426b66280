package io.hearthwarrio.formweaver.core.anchor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Anchor pairs, auxiliary correlation pairs and field-to-column fill mappings for one session.
 * <p>
 * Mutable while a session is being configured. {@link #freeze()} is called when the session starts;
 * any later mutation throws {@link IllegalStateException}.
 */
public final class AnchorConfig {

    private final List<AnchorPair> anchors = new ArrayList<>();
    private final List<AnchorPair> auxiliaries = new ArrayList<>();
    private final Map<String, String> fillMappings = new LinkedHashMap<>();
    private boolean autoMatched;
    private double confidence;
    private volatile boolean frozen;

    public AnchorConfig addAnchor(AnchorPair pair) {
        checkMutable();
        anchors.add(Objects.requireNonNull(pair, "pair must not be null"));
        return this;
    }

    public AnchorConfig addAuxiliary(AnchorPair pair) {
        checkMutable();
        auxiliaries.add(Objects.requireNonNull(pair, "pair must not be null"));
        return this;
    }

    /**
     * @param sourceField source field to write
     * @param columnLabel header text of the destination input column
     */
    public AnchorConfig addFillMapping(String sourceField, String columnLabel) {
        checkMutable();
        fillMappings.put(
                Objects.requireNonNull(sourceField, "sourceField must not be null"),
                Objects.requireNonNull(columnLabel, "columnLabel must not be null")
        );
        return this;
    }

    public AnchorConfig setEnabled(String sourceField, boolean enabled) {
        checkMutable();
        for (int i = 0; i < anchors.size(); i++) {
            if (anchors.get(i).getSourceField().equals(sourceField)) {
                anchors.set(i, anchors.get(i).withEnabled(enabled));
            }
        }
        return this;
    }

    AnchorConfig markAutoMatched(double confidence) {
        checkMutable();
        this.autoMatched = true;
        this.confidence = confidence;
        return this;
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * First enabled anchor pair; it drives row correlation.
     */
    public Optional<AnchorPair> primary() {
        for (AnchorPair p : anchors) {
            if (p.isEnabled()) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    public List<AnchorPair> getAnchors() {
        return Collections.unmodifiableList(anchors);
    }

    public List<AnchorPair> getAuxiliaries() {
        return Collections.unmodifiableList(auxiliaries);
    }

    public Map<String, String> getFillMappings() {
        return Collections.unmodifiableMap(fillMappings);
    }

    public boolean isAutoMatched() {
        return autoMatched;
    }

    /**
     * Mean similarity of the automatically chosen pairs, 0..100.
     */
    public double getConfidence() {
        return confidence;
    }

    /**
     * @return human-readable problems, empty when the configuration is usable
     */
    public List<String> validate(List<String> sourceFields) {
        List<String> problems = new ArrayList<>();
        Optional<AnchorPair> primary = primary();
        if (primary.isEmpty()) {
            problems.add("No enabled anchor");
        } else {
            if (!sourceFields.contains(primary.get().getSourceField())) {
                problems.add("Anchor field '" + primary.get().getSourceField() + "' is not in the source");
            }
            if (primary.get().getColumnXPath().isBlank()) {
                problems.add("Anchor '" + primary.get().getSourceField() + "' has no page column");
            }
        }
        if (fillMappings.isEmpty()) {
            problems.add("No fill mapping");
        }
        for (String field : fillMappings.keySet()) {
            if (!sourceFields.contains(field)) {
                problems.add("Mapped field '" + field + "' is not in the source");
            }
        }
        return problems;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Anchor configuration is frozen for the running session");
        }
    }

    @Override
    public String toString() {
        return "AnchorConfig{" +
                "anchors=" + anchors +
                ", auxiliaries=" + auxiliaries.size() +
                ", fillMappings=" + fillMappings +
                (autoMatched ? ", confidence=" + Math.round(confidence) : "") +
                '}';
    }
}

package io.hearthwarrio.formweaver.core.match;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops near-duplicate controls that share a base label.
 * <p>
 * Claimed controls win over unclaimed ones; among unclaimed duplicates the most stable one is kept.
 * Controls without any text anchor cannot be compared and are always kept.
 */
public final class FingerprintDeduplicator {

    /**
     * @param claimed   controls already matched to a field; their labels are taken
     * @param unclaimed remaining controls
     * @return surviving unclaimed controls, most stable first
     */
    public List<ElementFingerprint> deduplicate(List<ElementFingerprint> claimed, List<ElementFingerprint> unclaimed) {
        Set<String> seen = new HashSet<>();
        for (ElementFingerprint fp : claimed) {
            String key = key(fp);
            if (!key.isEmpty()) {
                seen.add(key);
            }
        }

        List<ElementFingerprint> sorted = new ArrayList<>(unclaimed);
        sorted.sort(Comparator.comparingInt(ElementFingerprint::getStabilityScore).reversed());

        List<ElementFingerprint> out = new ArrayList<>(sorted.size());
        for (ElementFingerprint fp : sorted) {
            String key = key(fp);
            if (key.isEmpty() || seen.add(key)) {
                out.add(fp);
            }
        }
        return out;
    }

    private static String key(ElementFingerprint fp) {
        String base = TextNormalizer.normalize(fp.baseLabel());
        return base.isEmpty() ? "" : base + "@" + fp.getFrame().describe();
    }
}

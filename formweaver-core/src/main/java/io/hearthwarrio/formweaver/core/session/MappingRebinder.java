package io.hearthwarrio.formweaver.core.session;

import io.hearthwarrio.formweaver.core.match.TextNormalizer;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Points mappings at freshly scanned controls after the page was re-rendered.
 * <p>
 * A fresh control replaces a mapped one when, in the same frame, it has the same structural row XPath, or else
 * the same id, or else the same tag and normalized label. Mappings without a counterpart are left unchanged.
 */
final class MappingRebinder {

    private MappingRebinder() {
        // utility class
    }

    /**
     * @return number of mappings that were replaced
     */
    static int rebind(Map<String, ElementFingerprint> mappings, List<ElementFingerprint> fresh) {
        int replaced = 0;
        for (Map.Entry<String, ElementFingerprint> e : mappings.entrySet()) {
            Optional<ElementFingerprint> match = find(e.getValue(), fresh);
            if (match.isPresent()) {
                e.setValue(match.get());
                replaced++;
            }
        }
        return replaced;
    }

    static Optional<ElementFingerprint> find(ElementFingerprint old, List<ElementFingerprint> fresh) {
        Optional<String> xpath = old.genericRowXPath();
        if (xpath.isPresent()) {
            for (ElementFingerprint f : fresh) {
                if (f.getFrame().equals(old.getFrame()) && xpath.equals(f.genericRowXPath())) {
                    return Optional.of(f);
                }
            }
        }
        if (!old.getId().isBlank()) {
            for (ElementFingerprint f : fresh) {
                if (f.getFrame().equals(old.getFrame()) && old.getId().equals(f.getId())) {
                    return Optional.of(f);
                }
            }
        }
        String label = TextNormalizer.normalize(old.baseLabel());
        if (!label.isEmpty()) {
            for (ElementFingerprint f : fresh) {
                if (f.getFrame().equals(old.getFrame())
                        && f.getTag().equals(old.getTag())
                        && label.equals(TextNormalizer.normalize(f.baseLabel()))) {
                    return Optional.of(f);
                }
            }
        }
        return Optional.empty();
    }
}

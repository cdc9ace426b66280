package io.hearthwarrio.formweaver.core.pagination;

import io.hearthwarrio.formweaver.core.browser.DomProbe;
import io.hearthwarrio.formweaver.core.browser.NavigationCandidate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lists elements that look like "next page" controls.
 */
public final class PaginationDetector {

    public static final int MAX_CANDIDATES = 10;

    private final PaginationSettings settings;

    public PaginationDetector(PaginationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * @return at most {@value #MAX_CANDIDATES} candidates with distinct text, in document order
     */
    public List<NavigationCandidate> detect(DomProbe probe) {
        Objects.requireNonNull(probe, "probe must not be null");
        List<NavigationCandidate> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (NavigationCandidate c : probe.listNavigationCandidates(settings.getNextKeywords())) {
            if (out.size() >= MAX_CANDIDATES) {
                break;
            }
            if (seen.add(c.getText())) {
                out.add(c);
            }
        }
        return out;
    }
}

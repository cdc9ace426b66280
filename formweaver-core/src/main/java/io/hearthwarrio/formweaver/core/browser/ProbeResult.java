package io.hearthwarrio.formweaver.core.browser;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.List;
import java.util.Objects;

/**
 * Result of one control snapshot probe.
 * <p>
 * A probe either reports that a loading overlay is still visible, or returns the controls it found.
 */
public final class ProbeResult {

    private static final ProbeResult LOADING = new ProbeResult(true, List.of());

    private final boolean loading;
    private final List<ElementFingerprint> elements;

    private ProbeResult(boolean loading, List<ElementFingerprint> elements) {
        this.loading = loading;
        this.elements = List.copyOf(elements);
    }

    public static ProbeResult loading() {
        return LOADING;
    }

    public static ProbeResult of(List<ElementFingerprint> elements) {
        return new ProbeResult(false, Objects.requireNonNull(elements, "elements must not be null"));
    }

    public boolean isLoading() {
        return loading;
    }

    public List<ElementFingerprint> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        return loading ? "ProbeResult{loading}" : "ProbeResult{elements=" + elements.size() + '}';
    }
}

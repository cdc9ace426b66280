package io.hearthwarrio.formweaver.core.scan;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.List;

/**
 * Best snapshot produced by a stability loop.
 */
public final class StableSnapshot {

    private final List<ElementFingerprint> elements;
    private final boolean stable;
    private final int polls;

    public StableSnapshot(List<ElementFingerprint> elements, boolean stable, int polls) {
        this.elements = List.copyOf(elements);
        this.stable = stable;
        this.polls = polls;
    }

    public List<ElementFingerprint> getElements() {
        return elements;
    }

    /**
     * True when the count settled; false when the budget ran out first.
     */
    public boolean isStable() {
        return stable;
    }

    public int getPolls() {
        return polls;
    }

    @Override
    public String toString() {
        return "StableSnapshot{elements=" + elements.size() + ", stable=" + stable + ", polls=" + polls + '}';
    }
}

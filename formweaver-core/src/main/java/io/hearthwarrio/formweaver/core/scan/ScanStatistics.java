package io.hearthwarrio.formweaver.core.scan;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

import java.util.List;

/**
 * Counters logged after a scan.
 */
public final class ScanStatistics {

    private final int total;
    private final int inTables;
    private final int inFrames;
    private final int highStability;
    private final int mediumStability;
    private final int lowStability;

    private ScanStatistics(int total, int inTables, int inFrames, int high, int medium, int low) {
        this.total = total;
        this.inTables = inTables;
        this.inFrames = inFrames;
        this.highStability = high;
        this.mediumStability = medium;
        this.lowStability = low;
    }

    public static ScanStatistics of(List<ElementFingerprint> fingerprints) {
        int tables = 0;
        int frames = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (ElementFingerprint fp : fingerprints) {
            if (fp.isInTable()) {
                tables++;
            }
            if (!fp.getFrame().isTop()) {
                frames++;
            }
            int s = fp.getStabilityScore();
            if (s >= 70) {
                high++;
            } else if (s >= 40) {
                medium++;
            } else {
                low++;
            }
        }
        return new ScanStatistics(fingerprints.size(), tables, frames, high, medium, low);
    }

    public int getTotal() {
        return total;
    }

    public int getInTables() {
        return inTables;
    }

    public int getInFrames() {
        return inFrames;
    }

    public int getHighStability() {
        return highStability;
    }

    public int getMediumStability() {
        return mediumStability;
    }

    public int getLowStability() {
        return lowStability;
    }

    @Override
    public String toString() {
        return total + " controls (table: " + inTables + ", framed: " + inFrames
                + ", stability high/mid/low: " + highStability + "/" + mediumStability + "/" + lowStability + ")";
    }
}

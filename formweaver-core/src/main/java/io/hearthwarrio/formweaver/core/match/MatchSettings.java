package io.hearthwarrio.formweaver.core.match;

/**
 * Matcher thresholds: a field matches at 60 or more, and matches at 90 or more are auto-apply suggestions.
 */
public final class MatchSettings {

    public static final int DEFAULT_THRESHOLD = 60;
    public static final int DEFAULT_SUGGESTION_THRESHOLD = 90;

    private final int threshold;
    private final int suggestionThreshold;

    public MatchSettings(int threshold, int suggestionThreshold) {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("threshold must be within 0..100");
        }
        if (suggestionThreshold < threshold || suggestionThreshold > 100) {
            throw new IllegalArgumentException("suggestionThreshold must be within threshold..100");
        }
        this.threshold = threshold;
        this.suggestionThreshold = suggestionThreshold;
    }

    public static MatchSettings defaults() {
        return new MatchSettings(DEFAULT_THRESHOLD, DEFAULT_SUGGESTION_THRESHOLD);
    }

    public int getThreshold() {
        return threshold;
    }

    public int getSuggestionThreshold() {
        return suggestionThreshold;
    }

    @Override
    public String toString() {
        return "MatchSettings{threshold=" + threshold + ", suggestion=" + suggestionThreshold + '}';
    }
}

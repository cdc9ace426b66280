package io.hearthwarrio.formweaver.core;

/**
 * Receives coarse progress of a running session.
 */
@FunctionalInterface
public interface FillProgressSink {

    /**
     * @param current number of source rows handled so far
     * @param total   number of source rows in the session
     * @param page    current destination page, 1-based
     */
    void onProgress(int current, int total, int page);

    static FillProgressSink discarding() {
        return (current, total, page) -> {
        };
    }
}

package io.hearthwarrio.formweaver.core.session;

import io.hearthwarrio.formweaver.core.anchor.FillQueue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one fill session.
 * <p>
 * Written by the session worker and read by callers on other threads; every access is synchronized.
 * Status changes follow {@link SessionStatus}; an illegal transition throws {@link IllegalStateException}.
 */
public final class FillSessionState {

    private SessionStatus status = SessionStatus.IDLE;
    private int totalRows;
    private int currentIndex;
    private int currentPage = 1;
    private int pageStartIndex;
    private int successCount;
    private int errorCount;
    private int skippedCount;
    private int healedCount;
    private boolean awaitingPageTurn;
    private String pauseReason = "";
    private FillQueue queue;

    private final List<String> errors = new ArrayList<>();
    private final Set<Integer> processedRows = new LinkedHashSet<>();
    private final Map<Integer, String> skipReasons = new LinkedHashMap<>();

    public synchronized void start(int totalRows) {
        require(status == SessionStatus.IDLE, "start");
        this.totalRows = totalRows;
        this.status = SessionStatus.RUNNING;
    }

    public synchronized void pause(String reason) {
        require(status == SessionStatus.RUNNING, "pause");
        this.status = SessionStatus.PAUSED;
        this.pauseReason = reason == null ? "" : reason;
    }

    public synchronized void resume() {
        require(status == SessionStatus.PAUSED, "resume");
        this.status = SessionStatus.RUNNING;
        this.pauseReason = "";
    }

    public synchronized void complete() {
        require(status == SessionStatus.RUNNING, "complete");
        this.status = SessionStatus.COMPLETED;
    }

    public synchronized void abort() {
        require(status.isActive(), "abort");
        this.status = SessionStatus.ABORTED;
    }

    private void require(boolean legal, String transition) {
        if (!legal) {
            throw new IllegalStateException("Cannot " + transition + " a session that is " + status);
        }
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized boolean isRunning() {
        return status == SessionStatus.RUNNING;
    }

    public synchronized boolean isPaused() {
        return status == SessionStatus.PAUSED;
    }

    public synchronized String getPauseReason() {
        return pauseReason;
    }

    public synchronized int getTotalRows() {
        return totalRows;
    }

    /**
     * Next row to fill in sequential mode; next queue position in anchor mode.
     */
    public synchronized int getCurrentIndex() {
        return currentIndex;
    }

    public synchronized void setCurrentIndex(int currentIndex) {
        this.currentIndex = currentIndex;
    }

    public synchronized int getCurrentPage() {
        return currentPage;
    }

    public synchronized void setCurrentPage(int currentPage) {
        this.currentPage = currentPage;
    }

    /**
     * Index of the first source row placed on the current page.
     */
    public synchronized int getPageStartIndex() {
        return pageStartIndex;
    }

    public synchronized void setPageStartIndex(int pageStartIndex) {
        this.pageStartIndex = pageStartIndex;
    }

    public synchronized boolean isAwaitingPageTurn() {
        return awaitingPageTurn;
    }

    public synchronized void setAwaitingPageTurn(boolean awaitingPageTurn) {
        this.awaitingPageTurn = awaitingPageTurn;
    }

    public synchronized Optional<FillQueue> getQueue() {
        return Optional.ofNullable(queue);
    }

    public synchronized void setQueue(FillQueue queue) {
        this.queue = queue;
    }

    synchronized void recordSuccess(int sourceIndex, int healed) {
        processedRows.add(sourceIndex);
        successCount++;
        healedCount += healed;
    }

    synchronized void recordError(int sourceIndex, String message) {
        processedRows.add(sourceIndex);
        errorCount++;
        errors.add(message);
    }

    synchronized void recordSkipped(int sourceIndex) {
        processedRows.add(sourceIndex);
        skippedCount++;
    }

    synchronized void markProcessed(int sourceIndex) {
        processedRows.add(sourceIndex);
    }

    synchronized void addSkipReason(int sourceIndex, String reason) {
        skipReasons.put(sourceIndex, reason);
    }

    public synchronized Optional<String> skipReason(int sourceIndex) {
        return Optional.ofNullable(skipReasons.get(sourceIndex));
    }

    public synchronized boolean isProcessed(int sourceIndex) {
        return processedRows.contains(sourceIndex);
    }

    public synchronized int getProcessedCount() {
        return processedRows.size();
    }

    public synchronized Set<Integer> getProcessedRows() {
        return Set.copyOf(processedRows);
    }

    public synchronized int getSuccessCount() {
        return successCount;
    }

    public synchronized int getErrorCount() {
        return errorCount;
    }

    public synchronized int getSkippedCount() {
        return skippedCount;
    }

    public synchronized int getHealedCount() {
        return healedCount;
    }

    public synchronized List<String> getErrors() {
        return List.copyOf(errors);
    }

    public synchronized SessionSummary summary() {
        return new SessionSummary(status, totalRows, successCount, errorCount, skippedCount, healedCount,
                currentPage, errors);
    }

    @Override
    public synchronized String toString() {
        return "FillSessionState{" +
                "status=" + status +
                ", index=" + currentIndex +
                ", page=" + currentPage +
                ", ok=" + successCount +
                ", errors=" + errorCount +
                ", skipped=" + skippedCount +
                '}';
    }
}

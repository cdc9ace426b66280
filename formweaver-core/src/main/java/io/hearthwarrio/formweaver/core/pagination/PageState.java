package io.hearthwarrio.formweaver.core.pagination;

import java.time.Instant;
import java.util.Objects;

/**
 * Lightweight snapshot used to tell whether a navigation click changed anything.
 */
public final class PageState {

    private final int pageNumber;
    private final String url;
    private final String contentFingerprint;
    private final int controlCount;
    private final Instant capturedAt;

    public PageState(int pageNumber, String url, String contentFingerprint, int controlCount, Instant capturedAt) {
        this.pageNumber = pageNumber;
        this.url = url == null ? "" : url;
        this.contentFingerprint = contentFingerprint == null ? "" : contentFingerprint;
        this.controlCount = controlCount;
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt must not be null");
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public String getUrl() {
        return url;
    }

    /**
     * {@code page:<indicator>}, {@code row:<first row text>}, {@code input:<first table input>},
     * or a time-based value when the page offers none of those.
     */
    public String getContentFingerprint() {
        return contentFingerprint;
    }

    public int getControlCount() {
        return controlCount;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    /**
     * The page changed when its address or its content fingerprint did.
     */
    public boolean differsFrom(PageState previous) {
        return !url.equals(previous.url) || !contentFingerprint.equals(previous.contentFingerprint);
    }

    @Override
    public String toString() {
        return "PageState{" +
                "page=" + pageNumber +
                ", url='" + url + '\'' +
                ", content='" + contentFingerprint + '\'' +
                ", controls=" + controlCount +
                '}';
    }
}

package io.hearthwarrio.formweaver.core.pagination;

/**
 * Notified after a navigation click produced a new page.
 */
@FunctionalInterface
public interface PageChangeListener {
    void onPageChanged(int pageNumber, PageState state);
}

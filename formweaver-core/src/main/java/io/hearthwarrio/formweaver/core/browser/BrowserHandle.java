package io.hearthwarrio.formweaver.core.browser;

import java.util.List;

/**
 * Opaque browser capability used by the core.
 * <p>
 * Launch and connection management belong to whoever creates the handle.
 * A handle is used from one thread at a time.
 */
public interface BrowserHandle extends DomProbe, DomWriter {

    /**
     * Switches into a nested document, starting from the top document.
     *
     * @param path frame indexes from the top document
     * @throws io.hearthwarrio.formweaver.core.FrameUnreachableException when any step cannot be entered
     */
    void enterFrame(List<Integer> path);

    /**
     * Switches back to the top document.
     */
    void leaveFrames();
}

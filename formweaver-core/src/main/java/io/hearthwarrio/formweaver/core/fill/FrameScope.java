package io.hearthwarrio.formweaver.core.fill;

import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.model.FrameContext;

import java.util.Objects;

/**
 * Switches a handle into a frame for the duration of a try-with-resources block.
 * <p>
 * The handle is returned to the top document on close, whatever happened inside the block.
 * Entering the top document is a no-op.
 */
public final class FrameScope implements AutoCloseable {

    private final BrowserHandle handle;
    private final boolean switched;

    private FrameScope(BrowserHandle handle, boolean switched) {
        this.handle = handle;
        this.switched = switched;
    }

    /**
     * @throws io.hearthwarrio.formweaver.core.FrameUnreachableException when the frame cannot be entered;
     *                                                                    the handle is back in the top document
     */
    public static FrameScope enter(BrowserHandle handle, FrameContext frame) {
        Objects.requireNonNull(handle, "handle must not be null");
        Objects.requireNonNull(frame, "frame must not be null");
        if (frame.isTop()) {
            return new FrameScope(handle, false);
        }
        handle.leaveFrames();
        try {
            handle.enterFrame(frame.getPath());
        } catch (RuntimeException e) {
            handle.leaveFrames();
            throw e;
        }
        return new FrameScope(handle, true);
    }

    @Override
    public void close() {
        if (switched) {
            handle.leaveFrames();
        }
    }
}

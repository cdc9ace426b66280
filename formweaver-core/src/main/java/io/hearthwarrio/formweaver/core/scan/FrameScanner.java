package io.hearthwarrio.formweaver.core.scan;

import io.hearthwarrio.formweaver.core.FillLogSink;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.browser.FrameDescriptor;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.FrameContext;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Collects controls from nested frames.
 * <p>
 * Frames are visited depth-first with an explicit work stack, in document order. Every visit starts from
 * the top document and re-enters the full frame path, so a failure in one frame cannot leave the handle
 * inside another. A frame that cannot be listed or entered is skipped together with its subtree.
 */
public final class FrameScanner {

    private final PageScanner pageScanner;
    private final ScanSettings settings;
    private final FillLogSink log;

    public FrameScanner(PageScanner pageScanner, ScanSettings settings, FillLogSink log) {
        this.pageScanner = Objects.requireNonNull(pageScanner, "pageScanner must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    private static final class PendingFrame {
        final FrameContext context;
        final String source;

        PendingFrame(FrameContext context, String source) {
            this.context = context;
            this.source = source;
        }
    }

    /**
     * Scans every frame reachable from the top document, not the top document itself.
     * The handle is left in the top document.
     */
    public List<ElementFingerprint> scanFrames(BrowserHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");

        List<ElementFingerprint> out = new ArrayList<>();
        Deque<PendingFrame> stack = new ArrayDeque<>();
        try {
            handle.leaveFrames();
            pushChildren(stack, FrameContext.TOP, handle.listChildFrames());

            while (!stack.isEmpty()) {
                PendingFrame frame = stack.pop();
                try {
                    out.addAll(scanFrame(handle, frame, stack));
                } catch (RuntimeException e) {
                    log.warning("Frame " + frame.context.describe() + " skipped: " + e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            log.warning("Frame enumeration failed: " + e.getMessage());
        } finally {
            handle.leaveFrames();
        }
        return out;
    }

    private List<ElementFingerprint> scanFrame(BrowserHandle handle, PendingFrame frame, Deque<PendingFrame> stack) {
        handle.leaveFrames();
        handle.enterFrame(frame.context.getPath());

        StabilityBudget budget = settings.frameBudget(frame.source);
        StableSnapshot snapshot = pageScanner.awaitStable(handle, budget);

        List<ElementFingerprint> found = new ArrayList<>(snapshot.getElements().size());
        for (ElementFingerprint fp : snapshot.getElements()) {
            found.add(fp.withFrame(frame.context));
        }
        if (!found.isEmpty()) {
            log.info("Frame " + frame.context.describe() + ": " + found.size() + " controls"
                    + (settings.isBusinessFrame(frame.source) ? " (business frame)" : ""));
        }

        if (frame.context.getDepth() < settings.getMaxFrameDepth()) {
            pushChildren(stack, frame.context, handle.listChildFrames());
        }
        return found;
    }

    private void pushChildren(Deque<PendingFrame> stack, FrameContext parent, List<FrameDescriptor> children) {
        if (parent.getDepth() >= settings.getMaxFrameDepth()) {
            return;
        }
        // reverse push keeps document order on pop
        for (int i = children.size() - 1; i >= 0; i--) {
            FrameDescriptor child = children.get(i);
            if (child.getWidth() < settings.getMinFrameSize() || child.getHeight() < settings.getMinFrameSize()) {
                continue;
            }
            stack.push(new PendingFrame(parent.child(child.getIndex()), child.getSource()));
        }
    }
}

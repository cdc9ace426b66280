package io.hearthwarrio.formweaver.core.session;

import io.hearthwarrio.formweaver.core.anchor.FillQueue;
import io.hearthwarrio.formweaver.core.anchor.FillTask;
import io.hearthwarrio.formweaver.core.anchor.TaskStatus;
import io.hearthwarrio.formweaver.core.fill.FillMode;
import io.hearthwarrio.formweaver.core.fill.FrameScope;
import io.hearthwarrio.formweaver.core.fill.RowOutcome;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.SourceRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs source rows with page rows by the value of a key column.
 * <p>
 * For each page the rows not handled yet are resolved against the key column shown on that page; rows whose
 * key is absent wait for a later page and end up skipped if no page has them. Resolved tasks run in page
 * order from the queue cursor. Single-record mode pauses after every task.
 */
public final class AnchorFillStrategy implements FillStrategy {

    @Override
    public void execute(FillContext context) {
        context.engine().awaitQuietPage();
        if (context.state().getQueue().isEmpty()) {
            resolveCurrentPage(context);
        }
        drain(context);
    }

    @Override
    public void continueFill(FillContext context) {
        FillSessionState state = context.state();
        if (state.isAwaitingPageTurn()) {
            context.acceptManualPageTurn();
            context.engine().awaitQuietPage();
            resolveCurrentPage(context);
        }
        drain(context);
    }

    void resolveCurrentPage(FillContext context) {
        FillSessionState state = context.state();
        List<SourceRow> remaining = new ArrayList<>();
        for (SourceRow row : context.rows()) {
            if (!state.isProcessed(row.getIndex())) {
                remaining.add(row);
            }
        }

        ElementFingerprint keyFp = context.keyFingerprint()
                .orElseThrow(() -> new IllegalStateException("Anchor strategy without a key control"));
        String keyField = context.keyField()
                .orElseThrow(() -> new IllegalStateException("Anchor strategy without a key field"));

        FillQueue queue;
        try (FrameScope ignored = FrameScope.enter(context.handle(), keyFp.getFrame())) {
            queue = context.resolver().resolve(remaining, keyField, keyFp, context.handle());
        }
        for (FillTask t : queue.getTasks()) {
            if (t.getStatus() == TaskStatus.SKIPPED) {
                state.addSkipReason(t.getSourceIndex(), t.getMessage());
            }
        }
        state.setQueue(queue);
        state.setCurrentIndex(queue.cursor());

        int matched = queue.size() - queue.count(TaskStatus.SKIPPED);
        context.log().info("Page " + state.getCurrentPage() + ": " + matched + " of " + remaining.size()
                + " remaining row(s) found by " + keyField);
    }

    private void drain(FillContext context) {
        FillSessionState state = context.state();
        while (true) {
            FillQueue queue = state.getQueue()
                    .orElseThrow(() -> new IllegalStateException("No resolved queue"));

            while (queue.hasMore()) {
                if (context.shouldStop()) {
                    return;
                }
                FillTask task = queue.peek().orElseThrow();
                if (!task.isPending()) {
                    queue.advance();
                    state.setCurrentIndex(queue.cursor());
                    continue;
                }
                RowOutcome outcome = context.engine().fillRow(
                        task,
                        context.mappings(),
                        context.keyField().orElse(null),
                        task.getDestinationIndex(),
                        context.fillMode()
                );
                context.recordRow(task, outcome);
                queue.advance();
                state.setCurrentIndex(queue.cursor());

                if (context.fillMode() == FillMode.SINGLE_RECORD && !queue.takePending(1).isEmpty()) {
                    context.pauseHere("task " + queue.cursor() + " of " + queue.size()
                            + " entered, submit it and continue");
                    return;
                }
            }

            if (state.getProcessedCount() >= context.rows().size()) {
                return;
            }
            if (context.config().getPaginationMode() == PaginationMode.MANUAL) {
                state.setAwaitingPageTurn(true);
                context.pauseHere("page " + state.getCurrentPage() + " done, "
                        + (context.rows().size() - state.getProcessedCount())
                        + " row(s) not found yet, turn the page and continue");
                return;
            }
            if (!context.turnPage()) {
                return;
            }
            context.engine().awaitQuietPage();
            resolveCurrentPage(context);
        }
    }
}

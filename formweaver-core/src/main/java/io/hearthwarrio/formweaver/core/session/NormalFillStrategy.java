package io.hearthwarrio.formweaver.core.session;

import io.hearthwarrio.formweaver.core.anchor.FillTask;
import io.hearthwarrio.formweaver.core.fill.FillMode;
import io.hearthwarrio.formweaver.core.fill.RowOutcome;
import io.hearthwarrio.formweaver.core.model.SourceRow;

/**
 * Pairs source rows with page rows by position.
 * <p>
 * Single-record mode writes one row into the form and pauses so the user can submit it. Batch mode fills the
 * page row by row until the page is full, then turns the page (auto) or pauses for the user to turn it (manual).
 * A row where every field failed or found no control is taken as "past the last rendered row": it is not
 * counted and is retried on the next page. On the first row of a page the same signal is a real failure and is recorded.
 */
public final class NormalFillStrategy implements FillStrategy {

    @Override
    public void execute(FillContext context) {
        context.engine().awaitQuietPage();
        run(context);
    }

    @Override
    public void continueFill(FillContext context) {
        FillSessionState state = context.state();
        if (state.isAwaitingPageTurn()) {
            context.acceptManualPageTurn();
            state.setPageStartIndex(state.getCurrentIndex());
        }
        context.engine().awaitQuietPage();
        run(context);
    }

    private void run(FillContext context) {
        if (context.fillMode() == FillMode.SINGLE_RECORD) {
            runSingle(context);
        } else {
            runBatch(context);
        }
    }

    private void runSingle(FillContext context) {
        FillSessionState state = context.state();
        int total = context.rows().size();
        while (state.getCurrentIndex() < total) {
            if (context.shouldStop()) {
                return;
            }
            int i = state.getCurrentIndex();
            FillTask task = taskFor(context.rows().get(i), 0);
            RowOutcome outcome = context.engine().fillRow(
                    task, context.mappings(), context.keyField().orElse(null), 0, FillMode.SINGLE_RECORD);
            context.recordRow(task, outcome);
            state.setCurrentIndex(i + 1);
            if (i + 1 < total) {
                context.pauseHere("record " + (i + 1) + " of " + total + " entered, submit it and continue");
                return;
            }
        }
    }

    private void runBatch(FillContext context) {
        FillSessionState state = context.state();
        int total = context.rows().size();
        int capacity = context.pageCapacity();

        while (state.getCurrentIndex() < total) {
            if (context.shouldStop()) {
                return;
            }
            int i = state.getCurrentIndex();
            int offset = i - state.getPageStartIndex();
            if (offset >= capacity) {
                if (!nextPage(context)) {
                    return;
                }
                capacity = context.pageCapacity();
                continue;
            }

            FillTask task = taskFor(context.rows().get(i), offset);
            RowOutcome outcome = context.engine().fillRow(
                    task, context.mappings(), context.keyField().orElse(null), offset, FillMode.BATCH_TABLE);

            if (outcome.indicatesEndOfTable(FillMode.BATCH_TABLE) && offset > 0) {
                context.log().info("Row " + (i + 1) + " found no control on page " + state.getCurrentPage()
                        + ", continuing on the next page");
                if (!nextPage(context)) {
                    return;
                }
                capacity = context.pageCapacity();
                continue;
            }
            context.recordRow(task, outcome);
            state.setCurrentIndex(i + 1);
        }
    }

    /**
     * @return true when filling can go on right away on a new page
     */
    private boolean nextPage(FillContext context) {
        FillSessionState state = context.state();
        if (context.config().getPaginationMode() == PaginationMode.AUTO) {
            if (context.turnPage()) {
                state.setPageStartIndex(state.getCurrentIndex());
                context.engine().awaitQuietPage();
                return true;
            }
            context.log().info("No further page, " + (context.rows().size() - state.getCurrentIndex())
                    + " row(s) left without a destination");
            return false;
        }
        state.setAwaitingPageTurn(true);
        context.pauseHere("page " + state.getCurrentPage() + " is full, turn the page and continue");
        return false;
    }

    private static FillTask taskFor(SourceRow row, int offset) {
        return new FillTask(row.getIndex(), offset, row.getValues(), "");
    }
}

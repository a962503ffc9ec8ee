package mta.eda.receipts.model.status;

import static mta.eda.receipts.model.ModelValidation.requireNonNegative;

/**
 * Progress counters of the current (or last) run.
 */
public record Progress(int found, int scheduled, int completed, int failed) {

    public static final Progress EMPTY = new Progress(0, 0, 0, 0);

    public Progress {
        requireNonNegative(found, "Progress.found");
        requireNonNegative(scheduled, "Progress.scheduled");
        requireNonNegative(completed, "Progress.completed");
        requireNonNegative(failed, "Progress.failed");
    }
}

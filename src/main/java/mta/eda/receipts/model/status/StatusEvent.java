package mta.eda.receipts.model.status;

/**
 * A push-style status change: either a progress merge or an activity append.
 * Exactly one of {@code progress} and {@code activity} is set, matching {@code type}.
 */
public record StatusEvent(StatusEventType type, ProgressUpdate progress, Activity activity) {

    public static StatusEvent progress(ProgressUpdate update) {
        return new StatusEvent(StatusEventType.PROGRESS, update, null);
    }

    public static StatusEvent activity(Activity activity) {
        return new StatusEvent(StatusEventType.ACTIVITY, null, activity);
    }
}

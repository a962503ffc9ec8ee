package mta.eda.receipts.model.status;

import mta.eda.receipts.exception.InvalidModelException;

import java.util.ArrayList;
import java.util.List;

import static mta.eda.receipts.model.ModelValidation.orEmpty;
import static mta.eda.receipts.model.ModelValidation.requirePresent;

/**
 * Status
 * Immutable snapshot of processing state. The activity log holds at most
 * {@link #MAX_ACTIVITIES} entries, newest last; appending to a full log evicts the oldest.
 */
public record Status(
        boolean processing,
        String currentPageLabel,
        Progress progress,
        List<Activity> activities
) {

    public static final int MAX_ACTIVITIES = 10;

    public Status {
        currentPageLabel = orEmpty(currentPageLabel);
        requirePresent(progress, "Status.progress");
        activities = activities == null ? List.of() : List.copyOf(activities);
        if (activities.size() > MAX_ACTIVITIES) {
            throw new InvalidModelException("Status.activities must not exceed " + MAX_ACTIVITIES
                    + " entries, got " + activities.size());
        }
    }

    public static Status initial() {
        return new Status(false, "", Progress.EMPTY, List.of());
    }

    public Status withActivity(Activity activity) {
        List<Activity> log = new ArrayList<>(activities);
        log.add(requirePresent(activity, "activity"));
        while (log.size() > MAX_ACTIVITIES) {
            log.remove(0);
        }
        return new Status(processing, currentPageLabel, progress, log);
    }
}

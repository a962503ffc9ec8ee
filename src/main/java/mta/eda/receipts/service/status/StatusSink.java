package mta.eda.receipts.service.status;

import mta.eda.receipts.model.status.Status;
import mta.eda.receipts.model.status.StatusEvent;

import java.util.function.Consumer;

/**
 * Process-wide progress and activity store. Writers push events, readers pull immutable
 * snapshots or observe changes.
 */
public interface StatusSink {

    /**
     * Merges a progress event or appends an activity.
     *
     * @throws mta.eda.receipts.exception.StatusTrackingException for a null or incomplete event
     */
    void update(StatusEvent event);

    /**
     * @return the latest snapshot; never a partially applied update
     */
    Status getStatus();

    /**
     * @return a handle that removes the observer; calling it again does nothing
     */
    Runnable onChange(Consumer<Status> observer);
}

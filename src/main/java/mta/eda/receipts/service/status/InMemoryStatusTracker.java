package mta.eda.receipts.service.status;

import mta.eda.receipts.exception.StatusTrackingException;
import mta.eda.receipts.model.status.Status;
import mta.eda.receipts.model.status.StatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * InMemoryStatusTracker
 * Keeps the current {@link Status} in an atomic reference. Every update builds a new
 * snapshot and swaps it in, so {@link #getStatus()} is safe to call from any thread.
 */
@Service
public class InMemoryStatusTracker implements StatusSink {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStatusTracker.class);

    private final AtomicReference<Status> current = new AtomicReference<>(Status.initial());
    private final List<Consumer<Status>> observers = new CopyOnWriteArrayList<>();

    @Override
    public void update(StatusEvent event) {
        if (event == null || event.type() == null) {
            throw new StatusTrackingException("update", "Invalid event: type is required");
        }

        Status updated = switch (event.type()) {
            case PROGRESS -> {
                if (event.progress() == null) {
                    throw new StatusTrackingException("update", "Progress event without progress data");
                }
                yield current.updateAndGet(event.progress()::applyTo);
            }
            case ACTIVITY -> {
                if (event.activity() == null) {
                    throw new StatusTrackingException("update", "Activity event without activity data");
                }
                yield current.updateAndGet(status -> status.withActivity(event.activity()));
            }
        };

        logger.debug("Status updated by {} event: progress={}", event.type(), updated.progress());
        notifyObservers(updated);
    }

    @Override
    public Status getStatus() {
        return current.get();
    }

    @Override
    public Runnable onChange(Consumer<Status> observer) {
        if (observer == null) {
            throw new StatusTrackingException("onChange", "Observer is required");
        }
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    private void notifyObservers(Status status) {
        for (Consumer<Status> observer : observers) {
            try {
                observer.accept(status);
            } catch (RuntimeException e) {
                logger.error("Status observer failed: {}", e.getMessage(), e);
            }
        }
    }
}

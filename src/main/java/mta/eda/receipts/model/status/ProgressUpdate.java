package mta.eda.receipts.model.status;

import lombok.Builder;

/**
 * ProgressUpdate
 * Partial status change carried by a progress event. Only non-null fields are merged
 * into the current status; everything else is kept.
 */
@Builder
public record ProgressUpdate(
        Integer found,
        Integer scheduled,
        Integer completed,
        Integer failed,
        Boolean processing,
        String currentPageLabel
) {

    public static ProgressUpdate counters(int scheduled, int completed, int failed) {
        return ProgressUpdate.builder()
                .scheduled(scheduled)
                .completed(completed)
                .failed(failed)
                .build();
    }

    public static ProgressUpdate processing(boolean processing) {
        return ProgressUpdate.builder().processing(processing).build();
    }

    public Status applyTo(Status status) {
        Progress current = status.progress();
        Progress merged = new Progress(
                found != null ? found : current.found(),
                scheduled != null ? scheduled : current.scheduled(),
                completed != null ? completed : current.completed(),
                failed != null ? failed : current.failed());
        return new Status(
                processing != null ? processing : status.processing(),
                currentPageLabel != null ? currentPageLabel : status.currentPageLabel(),
                merged,
                status.activities());
    }
}

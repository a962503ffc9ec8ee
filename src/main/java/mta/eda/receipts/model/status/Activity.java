package mta.eda.receipts.model.status;

import java.time.Instant;

import static mta.eda.receipts.model.ModelValidation.requirePresent;
import static mta.eda.receipts.model.ModelValidation.requireText;

/**
 * A single timestamped scheduler event shown in the activity log.
 */
public record Activity(ActivityType type, String message, Instant timestamp) {

    public Activity {
        requirePresent(type, "Activity.type");
        requireText(message, "Activity.message");
        requirePresent(timestamp, "Activity.timestamp");
    }

    public static Activity info(String message) {
        return new Activity(ActivityType.INFO, message, Instant.now());
    }

    public static Activity success(String message) {
        return new Activity(ActivityType.SUCCESS, message, Instant.now());
    }

    public static Activity error(String message) {
        return new Activity(ActivityType.ERROR, message, Instant.now());
    }
}

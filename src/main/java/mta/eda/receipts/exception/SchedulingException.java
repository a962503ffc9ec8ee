package mta.eda.receipts.exception;

import lombok.Getter;

/**
 * SchedulingException
 * Raised by the delivery scheduler for rejected input, lifecycle misuse, or an order
 * whose receipt still failed after every retry (which aborts the rest of the run).
 */
@Getter
public class SchedulingException extends RuntimeException {

    public enum Reason {
        INVALID_INPUT,
        EXHAUSTED_RETRIES,
        INVALID_STATE
    }

    private final Reason reason;
    private final String orderId;
    private final int ordersCount;
    private final int attempts;

    private SchedulingException(Reason reason, String orderId, int ordersCount, int attempts,
                                String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.orderId = orderId;
        this.ordersCount = ordersCount;
        this.attempts = attempts;
    }

    public static SchedulingException invalidInput(String message, int ordersCount) {
        return new SchedulingException(Reason.INVALID_INPUT, null, ordersCount, 0, message, null);
    }

    public static SchedulingException invalidState(String message) {
        return new SchedulingException(Reason.INVALID_STATE, null, 0, 0, message, null);
    }

    public static SchedulingException exhaustedRetries(String orderId, int ordersCount, int attempts, Throwable cause) {
        return new SchedulingException(Reason.EXHAUSTED_RETRIES, orderId, ordersCount, attempts,
                "Receipt for order " + orderId + " failed after " + attempts + " attempts", cause);
    }
}

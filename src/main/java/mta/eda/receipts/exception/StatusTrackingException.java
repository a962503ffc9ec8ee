package mta.eda.receipts.exception;

import lombok.Getter;

/**
 * StatusTrackingException
 * Thrown when a status event cannot be applied.
 */
@Getter
public class StatusTrackingException extends RuntimeException {

    private final String operation;

    public StatusTrackingException(String operation, String message) {
        super(message);
        this.operation = operation;
    }
}

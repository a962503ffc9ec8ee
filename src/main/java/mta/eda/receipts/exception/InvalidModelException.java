package mta.eda.receipts.exception;

/**
 * InvalidModelException
 * Thrown when a model value is constructed with data that violates its invariants
 * (blank identifiers, negative amounts, oversized activity log).
 */
public class InvalidModelException extends RuntimeException {

    public InvalidModelException(String message) {
        super(message);
    }
}

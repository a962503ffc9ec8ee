package mta.eda.receipts.exception;

import lombok.Getter;

/**
 * EnrichmentException
 * Raised when an order cannot be enriched with vendor order details.
 * {@code statusCode} is only set for {@link Reason#UPSTREAM_STATUS}.
 */
@Getter
public class EnrichmentException extends RuntimeException {

    public enum Reason {
        MISSING_KEY,
        TRANSPORT_FAILURE,
        UPSTREAM_STATUS,
        MALFORMED_RESPONSE
    }

    private final Reason reason;
    private final String orderId;
    private final Integer statusCode;

    private EnrichmentException(Reason reason, String orderId, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.orderId = orderId;
        this.statusCode = statusCode;
    }

    public static EnrichmentException missingKey(String orderId) {
        return new EnrichmentException(Reason.MISSING_KEY, orderId, null,
                "Order " + orderId + " has no vendor lookup key, details cannot be fetched", null);
    }

    public static EnrichmentException transportFailure(String orderId, String message, Throwable cause) {
        return new EnrichmentException(Reason.TRANSPORT_FAILURE, orderId, null,
                "Order details request failed for order " + orderId + ": " + message, cause);
    }

    public static EnrichmentException upstreamStatus(String orderId, int statusCode) {
        return new EnrichmentException(Reason.UPSTREAM_STATUS, orderId, statusCode,
                "Order details API returned HTTP " + statusCode + " for order " + orderId, null);
    }

    public static EnrichmentException malformedResponse(String orderId, String detail) {
        return malformedResponse(orderId, detail, null);
    }

    public static EnrichmentException malformedResponse(String orderId, String detail, Throwable cause) {
        return new EnrichmentException(Reason.MALFORMED_RESPONSE, orderId, null,
                "Unexpected order details response for order " + orderId + ": " + detail, cause);
    }
}

package mta.eda.receipts.exception;

import lombok.Getter;
import mta.eda.receipts.model.receipt.GenerationMethod;

/**
 * ReceiptGenerationException
 * Raised by a receipt generator when a receipt cannot be produced.
 */
@Getter
public class ReceiptGenerationException extends RuntimeException {

    private final String orderId;
    private final GenerationMethod method;

    public ReceiptGenerationException(String orderId, GenerationMethod method, String message, Throwable cause) {
        super(message, cause);
        this.orderId = orderId;
        this.method = method;
    }
}

package mta.eda.receipts.service.scheduler;

import mta.eda.receipts.model.order.Order;
import mta.eda.receipts.model.receipt.GenerateOptions;
import mta.eda.receipts.model.receipt.Receipt;

/**
 * Produces the receipt PDF for one order. Supplied by the caller of the scheduler;
 * how the PDF is rendered is up to the implementation.
 */
public interface ReceiptGenerator {

    /**
     * @throws mta.eda.receipts.exception.ReceiptGenerationException when no receipt could be produced
     */
    Receipt generate(Order order, GenerateOptions options);
}

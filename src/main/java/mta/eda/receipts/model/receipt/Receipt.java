package mta.eda.receipts.model.receipt;

import mta.eda.receipts.exception.InvalidModelException;

import java.time.Instant;

import static mta.eda.receipts.model.ModelValidation.requirePresent;
import static mta.eda.receipts.model.ModelValidation.requireText;

/**
 * Receipt
 * A generated receipt PDF for one order.
 *
 * @param orderId        the order the receipt belongs to
 * @param filename       download path, always ending in {@code .pdf}
 * @param content        PDF bytes
 * @param generatedAt    when the PDF was produced
 * @param method         how it was produced
 * @param includesImages whether product images were rendered
 */
public record Receipt(
        String orderId,
        String filename,
        byte[] content,
        Instant generatedAt,
        GenerationMethod method,
        boolean includesImages
) {

    public Receipt {
        requireText(orderId, "Receipt.orderId");
        requireText(filename, "Receipt.filename");
        if (!filename.endsWith(".pdf")) {
            throw new InvalidModelException("Receipt.filename must end with .pdf: " + filename);
        }
        requirePresent(content, "Receipt.content");
        requirePresent(generatedAt, "Receipt.generatedAt");
        requirePresent(method, "Receipt.method");
    }
}

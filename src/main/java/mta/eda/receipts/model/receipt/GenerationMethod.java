package mta.eda.receipts.model.receipt;

import com.fasterxml.jackson.annotation.JsonValue;
import mta.eda.receipts.exception.InvalidModelException;

/**
 * How a receipt PDF is produced: through the page's print pipeline or by a direct download.
 */
public enum GenerationMethod {
    PRINT,
    DIRECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static GenerationMethod fromWire(String value) {
        for (GenerationMethod method : values()) {
            if (method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new InvalidModelException("Unknown generation method: '" + value + "'. Expected print or direct.");
    }
}

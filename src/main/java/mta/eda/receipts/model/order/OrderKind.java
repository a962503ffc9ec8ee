package mta.eda.receipts.model.order;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import mta.eda.receipts.exception.InvalidModelException;

/**
 * Where the purchase happened.
 */
public enum OrderKind {
    ONLINE("online"),
    IN_STORE("in-store");

    private final String wireName;

    OrderKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static OrderKind fromWire(String value) {
        if (value != null) {
            for (OrderKind kind : values()) {
                // "instore" is what the order history pages emit
                if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)
                        || (kind == IN_STORE && "instore".equalsIgnoreCase(value))) {
                    return kind;
                }
            }
        }
        throw new InvalidModelException("Unknown order kind: '" + value + "'. Expected online or in-store.");
    }
}

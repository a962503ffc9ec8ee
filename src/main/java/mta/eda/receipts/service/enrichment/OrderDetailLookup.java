package mta.eda.receipts.service.enrichment;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Function;

import static mta.eda.receipts.service.enrichment.OrderDetailsProtocol.ENVELOPE_KEY;
import static mta.eda.receipts.service.enrichment.OrderDetailsProtocol.ORDER_DETAILS_KEY;

/**
 * Result of locating the order record inside an order-details response: either the
 * record itself, or the path at which the nesting broke off.
 */
public record OrderDetailLookup(JsonNode detail, String missingPath) {

    /**
     * Walks {@code ptdOrderDetails.orderDetails.orderDetails}. Every level must be a JSON object.
     */
    public static OrderDetailLookup locate(JsonNode root) {
        if (root == null || !root.isObject()) {
            return new OrderDetailLookup(null, "$");
        }
        JsonNode current = root;
        StringBuilder path = new StringBuilder("$");
        for (String segment : new String[] {ENVELOPE_KEY, ORDER_DETAILS_KEY, ORDER_DETAILS_KEY}) {
            path.append('.').append(segment);
            current = current.get(segment);
            if (current == null || !current.isObject()) {
                return new OrderDetailLookup(null, path.toString());
            }
        }
        return new OrderDetailLookup(current, null);
    }

    public boolean isFound() {
        return detail != null;
    }

    public <X extends RuntimeException> JsonNode orElseThrow(Function<String, X> onMissing) {
        if (detail == null) {
            throw onMissing.apply(missingPath);
        }
        return detail;
    }
}

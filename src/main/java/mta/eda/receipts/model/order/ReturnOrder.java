package mta.eda.receipts.model.order;

import lombok.Builder;

import java.util.List;

import static mta.eda.receipts.model.ModelValidation.*;

/**
 * ReturnOrder
 * A return against a parent order. One value is produced per vendor return-shipment,
 * so a single vendor return can yield several of these.
 */
@Builder(toBuilder = true)
public record ReturnOrder(
        String returnId,
        String parentOrderId,
        String returnedDate,
        String dispositionType,
        int statusCode,
        String statusText,
        double merchandiseTotal,
        double couponTotal,
        double shippingRefund,
        double taxRefund,
        double refundTotal,
        List<OrderItem> items,
        String vendorLookupKey
) {

    public static final String UNKNOWN_DISPOSITION = "UNKNOWN";

    public ReturnOrder {
        requireText(returnId, "ReturnOrder.returnId");
        requireText(parentOrderId, "ReturnOrder.parentOrderId");
        requireText(returnedDate, "ReturnOrder.returnedDate");
        requireNonNegative(refundTotal, "ReturnOrder.refundTotal");
        dispositionType = dispositionType == null || dispositionType.isBlank()
                ? UNKNOWN_DISPOSITION
                : dispositionType;
        statusText = orEmpty(statusText);
        items = items == null ? List.of() : List.copyOf(items);
        if (vendorLookupKey != null && vendorLookupKey.isBlank()) {
            vendorLookupKey = null;
        }
    }
}

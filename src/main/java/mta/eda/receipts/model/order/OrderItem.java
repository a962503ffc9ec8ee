package mta.eda.receipts.model.order;

import lombok.Builder;

import java.util.List;

import static mta.eda.receipts.model.ModelValidation.*;

/**
 * OrderItem
 * One purchased (or returned) line. Absent strings default to empty, absent
 * coupon/tax totals and status code default to 0.
 */
@Builder(toBuilder = true)
public record OrderItem(
        String sku,
        String title,
        String imageRef,
        double unitPrice,
        int quantityOrdered,
        int quantityFulfilled,
        double lineTotal,
        double couponTotal,
        List<CouponCharge> couponBreakdown,
        double taxTotal,
        int statusCode,
        String statusText
) {

    public OrderItem {
        requireText(sku, "OrderItem.sku");
        title = orEmpty(title);
        imageRef = orEmpty(imageRef);
        statusText = orEmpty(statusText);
        requireNonNegative(unitPrice, "OrderItem.unitPrice");
        requireNonNegative(quantityOrdered, "OrderItem.quantityOrdered");
        requireNonNegative(quantityFulfilled, "OrderItem.quantityFulfilled");
        requireNonNegative(lineTotal, "OrderItem.lineTotal");
        requireNonNegative(couponTotal, "OrderItem.couponTotal");
        requireNonNegative(taxTotal, "OrderItem.taxTotal");
        couponBreakdown = couponBreakdown == null ? List.of() : List.copyOf(couponBreakdown);
    }
}

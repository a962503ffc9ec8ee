package mta.eda.receipts.model.order;

import lombok.Builder;
import mta.eda.receipts.model.schedule.DelayOverride;

import java.time.LocalDate;
import java.util.List;

import static mta.eda.receipts.model.ModelValidation.*;

/**
 * Order
 * One purchase, online or in-store. A discovered order carries only its identity and
 * the vendor lookup key; enrichment builds a new value with items, returns, financials
 * and store info filled in and {@code enriched} set. Values are never mutated.
 *
 * @param id                 stable vendor order / transaction number
 * @param date               purchase date
 * @param kind               online or in-store
 * @param detailsReference   opaque locator of the order-details page
 * @param vendorLookupKey    key required to fetch order details, absent for discovery-only orders
 * @param orderType          vendor order-type tag sent with the details request
 * @param enterpriseCode     vendor tenant code sent with the details request
 * @param customerNumber     customer account number, optional
 * @param items              purchased lines, empty until enriched
 * @param returns            returns against this order, empty until enriched
 * @param financials         order totals, absent until enriched
 * @param storeInfo          store metadata, in-store orders only
 * @param transactionBarCode receipt barcode printed by the store, optional
 * @param returnable         whether the vendor still accepts returns
 * @param timing             scheduling hint carried on the order, optional
 * @param enriched           true once details were fetched and parsed
 */
@Builder(toBuilder = true)
public record Order(
        String id,
        LocalDate date,
        OrderKind kind,
        String detailsReference,
        String vendorLookupKey,
        String orderType,
        String enterpriseCode,
        String customerNumber,
        List<OrderItem> items,
        List<ReturnOrder> returns,
        Financials financials,
        StoreInfo storeInfo,
        String transactionBarCode,
        boolean returnable,
        DelayOverride timing,
        boolean enriched
) {

    public Order {
        requireText(id, "Order.id");
        requirePresent(date, "Order.date");
        requirePresent(kind, "Order.kind");
        detailsReference = orEmpty(detailsReference);
        vendorLookupKey = blankToNull(vendorLookupKey);
        orderType = blankToNull(orderType);
        enterpriseCode = blankToNull(enterpriseCode);
        customerNumber = blankToNull(customerNumber);
        transactionBarCode = blankToNull(transactionBarCode);
        items = items == null ? List.of() : List.copyOf(items);
        returns = returns == null ? List.of() : List.copyOf(returns);
    }

    /**
     * Builds a discovery-only order: identity, kind and locators, nothing enriched.
     */
    public static Order discovered(String id, LocalDate date, OrderKind kind,
                                   String detailsReference, String vendorLookupKey) {
        return Order.builder()
                .id(id)
                .date(date)
                .kind(kind)
                .detailsReference(detailsReference)
                .vendorLookupKey(vendorLookupKey)
                .build();
    }

    public boolean hasVendorLookupKey() {
        return vendorLookupKey != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

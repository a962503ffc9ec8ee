package mta.eda.receipts.model.order;

/**
 * Order-level money totals as reported by the vendor. Missing upstream values are 0.
 */
public record Financials(
        double merchandiseTotal,
        double discountsTotal,
        double couponsTotal,
        double shippingTotal,
        double taxesTotal,
        double grandTotal
) {}

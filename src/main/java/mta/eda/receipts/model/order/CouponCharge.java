package mta.eda.receipts.model.order;

/**
 * One applied coupon or promotion on a line item.
 */
public record CouponCharge(String name, double amount) {

    public CouponCharge {
        name = name == null ? "" : name;
    }
}

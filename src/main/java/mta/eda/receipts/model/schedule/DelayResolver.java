package mta.eda.receipts.model.schedule;

import mta.eda.receipts.model.order.Order;

/**
 * Computes a timing override for one order while a schedule is built.
 * Returning {@code null} defers to the next override source.
 */
@FunctionalInterface
public interface DelayResolver {

    DelayOverride resolve(Order order);
}

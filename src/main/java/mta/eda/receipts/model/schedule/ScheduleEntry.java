package mta.eda.receipts.model.schedule;

import mta.eda.receipts.model.order.Order;

/**
 * An order paired with its delay in milliseconds from schedule start.
 */
public record ScheduleEntry(Order order, long delay) {}

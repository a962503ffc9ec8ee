package mta.eda.receipts.service.scheduler;

import mta.eda.receipts.model.order.Order;
import mta.eda.receipts.model.schedule.DelayOverride;
import mta.eda.receipts.model.schedule.Schedule;
import mta.eda.receipts.model.schedule.ScheduleEntry;
import mta.eda.receipts.model.schedule.TimingConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the delay of every order from schedule start.
 * <p>
 * Orders are grouped into batches of {@code maxConcurrent}; a batch starts at
 * {@code initialDelay + batchIndex * delayBetweenOrders}. One override may replace or shift
 * that value, looked up in this order: resolver function, per-id map, the order's own
 * timing hint. The result is rounded to whole milliseconds and floored at {@code minimumDelay}.
 */
public final class DelayCalculator {

    private DelayCalculator() {}

    public static Schedule plan(List<Order> orders, TimingConfig timing) {
        List<ScheduleEntry> entries = new ArrayList<>(orders.size());
        for (int index = 0; index < orders.size(); index++) {
            Order order = orders.get(index);
            entries.add(new ScheduleEntry(order, delayFor(order, index, timing)));
        }
        return Schedule.of(entries);
    }

    static long delayFor(Order order, int index, TimingConfig timing) {
        long batch = index / timing.maxConcurrent();
        double computed = timing.initialDelay() + batch * timing.delayBetweenOrders();

        DelayOverride override = overrideFor(order, timing);
        double raw = override != null ? override.applyTo(computed) : computed;

        return Math.max(timing.minimumDelay(), Math.round(raw));
    }

    private static DelayOverride overrideFor(Order order, TimingConfig timing) {
        if (timing.resolver() != null) {
            DelayOverride resolved = timing.resolver().resolve(order);
            if (resolved != null) {
                return resolved;
            }
        }
        DelayOverride mapped = timing.overrides().get(order.id());
        if (mapped != null) {
            return mapped;
        }
        return order.timing();
    }
}

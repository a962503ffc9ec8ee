package mta.eda.receipts.model.schedule;

import lombok.Builder;

import java.util.Map;

/**
 * TimingConfig
 * Timing rules for one schedule. All durations are milliseconds.
 * <p>
 * {@code maxConcurrent} only groups orders into delay batches; dispatch stays sequential.
 * Start from {@link #defaults()} and adjust with {@code toBuilder()}, a bare builder leaves
 * every number at zero.
 *
 * @param delayBetweenOrders gap between batches, also the wait before each retry
 * @param maxConcurrent      batch size
 * @param retryAttempts      additional attempts after the first failure
 * @param initialDelay       delay of the first batch
 * @param minimumDelay       floor applied to every computed delay
 * @param overrides          explicit per-order-id overrides
 * @param resolver           per-order override function, optional
 */
@Builder(toBuilder = true)
public record TimingConfig(
        long delayBetweenOrders,
        int maxConcurrent,
        int retryAttempts,
        long initialDelay,
        long minimumDelay,
        Map<String, DelayOverride> overrides,
        DelayResolver resolver
) {

    public static final long DEFAULT_DELAY_BETWEEN_ORDERS = 5000;
    public static final int DEFAULT_MAX_CONCURRENT = 1;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;

    public TimingConfig {
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public static TimingConfig defaults() {
        return new TimingConfig(DEFAULT_DELAY_BETWEEN_ORDERS, DEFAULT_MAX_CONCURRENT,
                DEFAULT_RETRY_ATTEMPTS, 0, 0, Map.of(), null);
    }
}

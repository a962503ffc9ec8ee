package mta.eda.receipts.model.schedule;

import mta.eda.receipts.exception.InvalidModelException;

/**
 * A per-order timing override: either an absolute delay from schedule start, or an
 * offset added to the computed batch delay. When both are set the absolute delay wins.
 */
public record DelayOverride(Double delay, Double offset) {

    public DelayOverride {
        if (delay == null && offset == null) {
            throw new InvalidModelException("DelayOverride needs a delay or an offset");
        }
    }

    public static DelayOverride absolute(double delay) {
        return new DelayOverride(delay, null);
    }

    public static DelayOverride offset(double offset) {
        return new DelayOverride(null, offset);
    }

    /**
     * @param computedDelay the batch-based delay this override replaces or shifts
     * @return the unclamped, unrounded delay
     */
    public double applyTo(double computedDelay) {
        return delay != null ? delay : computedDelay + offset;
    }
}

package qrelay.core.retry;

import java.time.Duration;
import java.util.Locale;

/**
 * Delay applied before a rejected message becomes visible again.
 * Implementations must be monotone non-decreasing in the delivery count.
 */
public interface BackoffPolicy {

    /**
     * @param deliveryCount deliveries made so far, at least 1
     * @return delay in milliseconds before the next delivery
     */
    long delayMillis(int deliveryCount);

    static BackoffPolicy none() {
        return deliveryCount -> 0L;
    }

    static BackoffPolicy linear(Duration step) {
        return new LinearBackoff(step.toMillis());
    }

    static BackoffPolicy exponential(Duration initial, double multiplier, Duration max) {
        return new ExponentialBackoff(initial.toMillis(), multiplier, max.toMillis());
    }

    /**
     * Resolves a policy by name: {@code none}, {@code linear} or {@code exponential}.
     */
    static BackoffPolicy named(String name, Duration step, Duration max) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> none();
            case "linear" -> linear(step);
            case "exponential" -> exponential(step, 2.0, max);
            default -> throw new IllegalArgumentException("Unknown backoff policy: " + name);
        };
    }
}

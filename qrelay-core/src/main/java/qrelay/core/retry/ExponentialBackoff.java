package qrelay.core.retry;

/**
 * {@code initial * multiplier^(deliveryCount - 1)}, capped at {@code max}.
 */
public class ExponentialBackoff implements BackoffPolicy {

    private final long initialMillis;
    private final double multiplier;
    private final long maxMillis;

    public ExponentialBackoff(long initialMillis, double multiplier, long maxMillis) {
        if (initialMillis < 0 || maxMillis < initialMillis) {
            throw new IllegalArgumentException("Invalid backoff bounds: initial=" + initialMillis + ", max=" + maxMillis);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0: " + multiplier);
        }
        this.initialMillis = initialMillis;
        this.multiplier = multiplier;
        this.maxMillis = maxMillis;
    }

    @Override
    public long delayMillis(int deliveryCount) {
        if (deliveryCount <= 0) {
            return 0L;
        }
        double delay = initialMillis * Math.pow(multiplier, deliveryCount - 1);
        return delay >= maxMillis ? maxMillis : (long) delay;
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{initialMillis=" + initialMillis + ", multiplier=" + multiplier + ", maxMillis=" + maxMillis + '}';
    }
}

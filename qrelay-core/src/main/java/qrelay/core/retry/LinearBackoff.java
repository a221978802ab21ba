package qrelay.core.retry;

/**
 * {@code step * deliveryCount}.
 */
public class LinearBackoff implements BackoffPolicy {

    private final long stepMillis;

    public LinearBackoff(long stepMillis) {
        if (stepMillis < 0) {
            throw new IllegalArgumentException("Backoff step must not be negative: " + stepMillis);
        }
        this.stepMillis = stepMillis;
    }

    @Override
    public long delayMillis(int deliveryCount) {
        return stepMillis * Math.max(deliveryCount, 0);
    }

    @Override
    public String toString() {
        return "LinearBackoff{stepMillis=" + stepMillis + '}';
    }
}

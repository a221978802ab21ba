package qrelay.core.exceptions;

/**
 * Send against a queue whose live message count has reached its maximum size.
 * Retrying is up to the producer.
 */
public class CapacityExceededException extends QRelayException {

    public static final String CODE = "CAPACITY_EXCEEDED";

    private final int maxSize;

    public CapacityExceededException(String queueId, int maxSize) {
        super("Queue overflow maximum reached: " + maxSize, CODE, queueId);
        this.maxSize = maxSize;
    }

    public int getMaxSize() {
        return maxSize;
    }
}

package qrelay.core.model;

import qrelay.config.QueueConfig;

/**
 * Queue definition. A regular queue points at its dead-letter queue through {@code dlqId};
 * a dead-letter queue points back at the queue that owns it through {@code originQueueId}.
 */
public record Queue(
        String queueId,
        String name,
        QueueDiscipline discipline,
        QueueConfig config,
        String dlqId,
        String originQueueId,
        long createdAt) {

    public boolean isDeadLetterQueue() {
        return discipline == QueueDiscipline.DLQ;
    }

    /**
     * Total deliveries allowed: the first one plus {@code maxRetries} retries.
     */
    public int maxAttempts() {
        return config.maxRetries() + 1;
    }
}

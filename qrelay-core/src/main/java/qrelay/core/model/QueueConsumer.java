package qrelay.core.model;

/**
 * Registered puller of a queue. Bookkeeping only, the registry owns no delivery state.
 */
public record QueueConsumer(String consumerId, String queueId, String name, int batchSize, long registeredAt) {
}

package qrelay.core.model;

import java.util.Map;

/**
 * Durable link from a dead-lettered message to the copy placed on the dead-letter queue.
 * {@code dlqMessageId} is null when no copy could be written; {@code replayedAt} is null
 * until the entry's body has been re-sent onto its origin queue.
 */
public record DeadLetterEntry(
        String entryId,
        String originalMessageId,
        String originalQueueId,
        String dlqMessageId,
        String body,
        Map<String, String> attributes,
        String reason,
        int failureCount,
        long deadLetteredAt,
        Long replayedAt) {

    public DeadLetterEntry {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean isReplayed() {
        return replayedAt != null;
    }

    public DeadLetterEntry replayed(long now) {
        return new DeadLetterEntry(entryId, originalMessageId, originalQueueId, dlqMessageId, body, attributes,
                reason, failureCount, deadLetteredAt, now);
    }
}

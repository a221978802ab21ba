package qrelay.core.model;

import java.util.Map;

/**
 * Immutable snapshot of a queued message. State changes produce a new snapshot that
 * replaces the previous one in the message store.
 */
public record Message(
                String messageId,
                String queueId,
                String body,
                Map<String, String> attributes,
                int priority,
                MessageState state,
                int deliveryCount,
                Long firstDeliveredAt,
                Long lastDeliveredAt,
                long visibleAt,
                long createdAt,
                long expiresAt,
                String dedupId,
                String groupId,
                long sequence) {

    /**
     * Default priority for messages when not specified
     */
    public static final int DEFAULT_PRIORITY = 5;

    /**
     * Lowest priority (least urgent)
     */
    public static final int MIN_PRIORITY = 0;

    /**
     * Highest priority (most urgent)
     */
    public static final int MAX_PRIORITY = 9;

    public Message {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Whether {@code receive} may hand this message out at {@code now}.
     */
    public boolean isVisibleAt(long now) {
        return state == MessageState.PENDING && visibleAt <= now && now < expiresAt;
    }

    public boolean isExpiredAt(long now) {
        return now >= expiresAt;
    }

    public boolean hasGroup() {
        return groupId != null && !groupId.isEmpty();
    }

    public Message delivered(long now, long visibleUntil) {
        return new Message(messageId, queueId, body, attributes, priority, MessageState.PROCESSING,
                deliveryCount + 1, firstDeliveredAt != null ? firstDeliveredAt : now, now,
                visibleUntil, createdAt, expiresAt, dedupId, groupId, sequence);
    }

    public Message requeued(long visibleAgainAt) {
        return new Message(messageId, queueId, body, attributes, priority, MessageState.PENDING,
                deliveryCount, firstDeliveredAt, lastDeliveredAt, visibleAgainAt, createdAt, expiresAt,
                dedupId, groupId, sequence);
    }

    public Message withState(MessageState newState) {
        return new Message(messageId, queueId, body, attributes, priority, newState,
                deliveryCount, firstDeliveredAt, lastDeliveredAt, visibleAt, createdAt, expiresAt,
                dedupId, groupId, sequence);
    }
}

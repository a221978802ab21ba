package qrelay.core.events;

public record LifecycleEvent(Type type, String queueId, String messageId, int deliveryCount, long timestamp, String detail) {

    public enum Type {
        SENT,
        DELIVERED,
        ACKED,
        REQUEUED,
        DEAD_LETTERED,
        EXPIRED,
        PURGED
    }
}

package qrelay.core.model;

public enum MessageState {
    PENDING(0),
    PROCESSING(1),
    COMPLETED(2),
    DEAD_LETTERED(3);

    private final int value;

    MessageState(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    // PENDING and PROCESSING messages count against a queue's capacity
    public boolean isLive() {
        return this == PENDING || this == PROCESSING;
    }

    public static MessageState fromValue(int value) {
        for (MessageState state : values()) {
            if (state.value == value) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown message state value: " + value);
    }
}

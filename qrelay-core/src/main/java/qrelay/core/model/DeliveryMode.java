package qrelay.core.model;

import java.util.Locale;

/**
 * Delivery guarantee of a queue.
 * <p>
 * {@link #EXACTLY_ONCE} is at-least-once delivery plus suppression of sends that repeat a
 * dedup id inside the broker's deduplication window. It is not a hard guarantee.
 */
public enum DeliveryMode {
    AT_MOST_ONCE("at_most_once"),
    AT_LEAST_ONCE("at_least_once"),
    EXACTLY_ONCE("exactly_once");

    private final String value;

    DeliveryMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DeliveryMode fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DeliveryMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown delivery mode: " + value);
    }
}

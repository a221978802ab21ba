package qrelay.core.model;

/**
 * Outcome of ack, nack and dead-letter calls. {@link #NOT_FOUND} is expected under
 * at-least-once delivery and is not an error.
 */
public enum AckResult {
    OK,
    NOT_FOUND
}

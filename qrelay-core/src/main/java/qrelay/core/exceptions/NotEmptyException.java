package qrelay.core.exceptions;

/**
 * Delete of a queue that still holds live messages, without {@code force}.
 */
public class NotEmptyException extends ConflictException {

    public static final String CODE = "NOT_EMPTY";

    private final int liveMessages;

    public NotEmptyException(String queueId, int liveMessages) {
        super("Queue still holds " + liveMessages + " live message(s)", CODE, queueId);
        this.liveMessages = liveMessages;
    }

    public int getLiveMessages() {
        return liveMessages;
    }
}

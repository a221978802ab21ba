package qrelay.core.exceptions;

public class QueueNotFoundException extends NotFoundException {

    public QueueNotFoundException(String queueId) {
        super("Queue not found: " + queueId, queueId);
    }
}

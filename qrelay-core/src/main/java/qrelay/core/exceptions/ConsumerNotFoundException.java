package qrelay.core.exceptions;

public class ConsumerNotFoundException extends NotFoundException {

    public ConsumerNotFoundException(String consumerId) {
        super("Consumer not found: " + consumerId, consumerId);
    }
}

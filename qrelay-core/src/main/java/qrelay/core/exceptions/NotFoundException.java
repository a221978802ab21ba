package qrelay.core.exceptions;

public abstract class NotFoundException extends QRelayException {

    public static final String CODE = "NOT_FOUND";

    protected NotFoundException(String message, String context) {
        super(message, CODE, context);
    }
}

package qrelay.core.exceptions;

public class ConflictException extends QRelayException {

    public static final String CODE = "CONFLICT";

    public ConflictException(String message, String context) {
        super(message, CODE, context);
    }

    protected ConflictException(String message, String errorCode, String context) {
        super(message, errorCode, context);
    }
}

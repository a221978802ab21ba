package qrelay.core.exceptions;

/**
 * Rejected configuration or argument. Never retried automatically.
 */
public class ValidationException extends QRelayException {

    public static final String CODE = "VALIDATION";

    public ValidationException(String message) {
        super(message, CODE, null);
    }

    public ValidationException(String message, String context) {
        super(message, CODE, context);
    }
}

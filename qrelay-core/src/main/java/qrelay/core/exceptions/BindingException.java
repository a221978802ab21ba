package qrelay.core.exceptions;

/**
 * A binding referencing a queue that does not exist. Raised at bind time so that
 * publishing never has to re-validate queue existence.
 */
public class BindingException extends QRelayException {

    public static final String CODE = "BINDING";

    public BindingException(String message, String context) {
        super(message, CODE, context);
    }
}

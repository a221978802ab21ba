package qrelay.core.exceptions;

/**
 * Failure of the underlying message store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

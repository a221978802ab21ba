package qrelay.core.exceptions;

/**
 * Base exception class for all QRelay-related exceptions.
 * Carries an error code that callers (such as the CLI) map to outcomes, and an optional
 * context naming the queue, exchange or message involved.
 */
public class QRelayException extends Exception {

    private final String errorCode;
    private final String context;

    /**
     * Creates a new QRelayException with a message.
     *
     * @param message The error message
     */
    public QRelayException(String message) {
        this(message, "QRELAY_ERROR", null);
    }

    /**
     * Creates a new QRelayException with a message, error code, and context.
     *
     * @param message The error message
     * @param errorCode The specific error code
     * @param context Additional context information
     */
    public QRelayException(String message, String errorCode, String context) {
        super(message);
        this.errorCode = errorCode;
        this.context = context;
    }

    /**
     * Creates a new QRelayException with a message, cause, error code, and context.
     *
     * @param message The error message
     * @param cause The underlying cause
     * @param errorCode The specific error code
     * @param context Additional context information
     */
    public QRelayException(String message, Throwable cause, String errorCode, String context) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return The context information, or null if none was provided
     */
    public String getContext() {
        return context;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        sb.append(" [").append(errorCode).append("]");
        if (context != null) {
            sb.append(" (").append(context).append(")");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}

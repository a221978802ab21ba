package qrelay.cli;

import qrelay.core.exceptions.BindingException;
import qrelay.core.exceptions.CapacityExceededException;
import qrelay.core.exceptions.ConflictException;
import qrelay.core.exceptions.NotFoundException;

/**
 * Process exit codes of the {@code qrelay} command.
 */
public final class ExitCodes {
    public static final int OK = 0;
    public static final int VALIDATION = 1;
    public static final int NOT_FOUND = 2;
    public static final int CONFLICT = 3;

    private ExitCodes() {
    }

    public static int forException(Throwable e) {
        if (e instanceof NotFoundException || e instanceof BindingException) {
            return NOT_FOUND;
        }
        if (e instanceof ConflictException || e instanceof CapacityExceededException) {
            return CONFLICT;
        }
        return VALIDATION;
    }
}

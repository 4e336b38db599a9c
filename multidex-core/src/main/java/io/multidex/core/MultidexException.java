package io.multidex.core;

/**
 * Unchecked failure raised by the store for conditions that cannot be reported
 * as a plain {@code false}: a release hook that throws, or a duplicate field
 * declaration under {@link MultidexConfiguration.DuplicateFieldPolicy#FAIL}.
 */
public class MultidexException extends RuntimeException {

    public MultidexException(String message, Throwable cause) {
        super(message, cause);
    }

    public MultidexException(String message) {
        super(message);
    }

}

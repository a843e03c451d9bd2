package com.polereduction.core.exceptions;

/**
 * Raised when pipeline input is malformed or out of range: mismatched
 * sequence lengths, fewer than two samples, a non-positive sampling interval,
 * an inclination outside {@code [-90, 90]} degrees or a non-finite value.
 *
 * @since 1.0.0
 */
public class ValidationException extends ReductionException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super("Invalid input: " + message);
    }

    public ValidationException(String message, Throwable cause) {
        super("Invalid input: " + message, cause);
    }
}

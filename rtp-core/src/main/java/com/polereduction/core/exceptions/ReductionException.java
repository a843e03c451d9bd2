package com.polereduction.core.exceptions;

/**
 * Common supertype of every error raised by the reduction-to-pole pipeline.
 *
 * <p>
 * Callers that only need to report a failure can catch this type; callers
 * that react differently to bad input and to a degenerate field geometry
 * catch {@link ValidationException} and
 * {@link NumericalInstabilityException} separately.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class ReductionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ReductionException(String message) {
        super(message);
    }

    protected ReductionException(String message, Throwable cause) {
        super(message, cause);
    }
}

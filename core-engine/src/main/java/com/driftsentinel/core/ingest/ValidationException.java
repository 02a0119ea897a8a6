package com.driftsentinel.core.ingest;

/**
 * Thrown when a raw record cannot be turned into a {@link com.driftsentinel.core.model.Sample}.
 *
 * <p>
 * Callers drop the record and count it; one bad record never stops the
 * stream.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

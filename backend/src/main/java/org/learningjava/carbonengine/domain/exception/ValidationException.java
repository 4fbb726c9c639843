package org.learningjava.carbonengine.domain.exception;

/** Malformed or missing activity fields. Always surfaced to the caller. */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

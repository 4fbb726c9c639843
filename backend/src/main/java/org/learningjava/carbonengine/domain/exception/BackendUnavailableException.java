package org.learningjava.carbonengine.domain.exception;

/** An external backend (LLM, embedding service) failed, timed out or returned garbage. */
public class BackendUnavailableException extends RuntimeException {
    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

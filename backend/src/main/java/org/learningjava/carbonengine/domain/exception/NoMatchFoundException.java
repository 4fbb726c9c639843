package org.learningjava.carbonengine.domain.exception;

public class NoMatchFoundException extends RuntimeException {
    public NoMatchFoundException(String message) {
        super(message);
    }
}

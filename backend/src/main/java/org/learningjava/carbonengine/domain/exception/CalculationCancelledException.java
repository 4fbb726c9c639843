package org.learningjava.carbonengine.domain.exception;

public class CalculationCancelledException extends RuntimeException {
    public CalculationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}

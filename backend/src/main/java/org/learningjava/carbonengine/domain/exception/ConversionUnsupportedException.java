package org.learningjava.carbonengine.domain.exception;

public class ConversionUnsupportedException extends RuntimeException {
    private final String fromUnit;
    private final String toUnit;

    public ConversionUnsupportedException(String fromUnit, String toUnit, String reason) {
        super("Cannot convert '" + fromUnit + "' to '" + toUnit + "': " + reason);
        this.fromUnit = fromUnit;
        this.toUnit = toUnit;
    }

    public String fromUnit() { return fromUnit; }
    public String toUnit() { return toUnit; }
}

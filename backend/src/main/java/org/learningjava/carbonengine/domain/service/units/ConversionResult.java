package org.learningjava.carbonengine.domain.service.units;

public record ConversionResult(
        double originalValue,
        String originalUnit,
        double convertedValue,
        String convertedUnit,
        double conversionFactor
) {}

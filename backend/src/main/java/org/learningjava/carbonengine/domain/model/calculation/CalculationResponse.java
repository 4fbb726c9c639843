package org.learningjava.carbonengine.domain.model.calculation;

/**
 * Outbound shape. {@code success} is true whenever a calculation was produced,
 * even if saving it failed; in that case {@code error} explains the save failure.
 */
public record CalculationResponse(
        boolean success,
        CalculationResult calculation,
        Long calculationId,
        String error
) {

    public static CalculationResponse ok(CalculationResult calculation, Long calculationId) {
        return new CalculationResponse(true, calculation, calculationId, null);
    }

    public static CalculationResponse okWithWarning(CalculationResult calculation, String error) {
        return new CalculationResponse(true, calculation, null, error);
    }

    public static CalculationResponse failed(String error) {
        return new CalculationResponse(false, null, null, error);
    }
}

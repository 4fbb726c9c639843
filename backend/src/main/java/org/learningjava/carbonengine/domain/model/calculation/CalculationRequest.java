package org.learningjava.carbonengine.domain.model.calculation;

import org.learningjava.carbonengine.domain.model.activity.StructuredActivity;

/**
 * Inbound request. Exactly one of {@code rawInput} / {@code structured} is expected;
 * when both are present the structured fields win.
 */
public record CalculationRequest(
        String rawInput,
        StructuredActivity structured,
        String companyId,
        boolean demoMode,
        String preferredSource
) {

    public static CalculationRequest ofText(String rawInput, boolean demoMode) {
        return new CalculationRequest(rawInput, null, null, demoMode, null);
    }

    public static CalculationRequest ofStructured(StructuredActivity structured, String companyId) {
        return new CalculationRequest(null, structured, companyId, false, null);
    }
}

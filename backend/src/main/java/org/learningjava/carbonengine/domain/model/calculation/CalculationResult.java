package org.learningjava.carbonengine.domain.model.calculation;

import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.GhgBreakdown;
import org.learningjava.carbonengine.domain.model.factor.MatchCandidate;
import org.learningjava.carbonengine.domain.model.factor.Scope;

import java.util.List;

public record CalculationResult(
        double totalEmissions,
        String emissionsUnit,
        GhgBreakdown breakdown,
        Scope scope,
        double confidence,
        EmissionFactorRecord matchedFactor,
        List<MatchCandidate> alternatives,
        BackendType backendUsed,
        long processingTimeMs,
        ParsedActivity activity,
        double convertedQuantity,
        List<String> fallbackReasons
) {
    public static final String KG_CO2E = "kg CO2e";
}

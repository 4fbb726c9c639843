package org.learningjava.carbonengine.domain.model.calculation;

import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.GhgBreakdown;
import org.learningjava.carbonengine.domain.model.factor.MatchCandidate;
import org.learningjava.carbonengine.domain.model.factor.Scope;

import java.util.List;

/**
 * What a backend hands back when it accepts an activity.
 * {@code scope} is null when the backend has no opinion; the orchestrator classifies then.
 */
public record BackendEstimate(
        double totalEmissions,
        String emissionsUnit,
        GhgBreakdown breakdown,
        Scope scope,
        double confidence,
        EmissionFactorRecord matchedFactor,
        List<MatchCandidate> alternatives,
        double convertedQuantity
) {}

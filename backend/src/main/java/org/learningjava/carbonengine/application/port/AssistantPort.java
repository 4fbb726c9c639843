package org.learningjava.carbonengine.application.port;

import org.learningjava.carbonengine.domain.model.factor.GhgBreakdown;

import java.util.List;

/**
 * Structured-reasoning backend that estimates emissions for an activity on its own,
 * without the reference dataset. Implementations may block on network I/O.
 */
public interface AssistantPort {

    AssistantEstimate structuredCalculate(String description, List<String> hints);

    record AssistantEstimate(
            double emissionFactor,
            String emissionFactorUnit,
            Double totalEmissions,
            String scope,
            String source,
            Double confidence,
            GhgBreakdown breakdown
    ) {}
}

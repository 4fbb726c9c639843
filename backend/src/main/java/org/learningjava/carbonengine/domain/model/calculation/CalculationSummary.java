package org.learningjava.carbonengine.domain.model.calculation;

import java.time.OffsetDateTime;
import java.util.Map;

public record CalculationSummary(
        int totalCalculations,
        Map<BackendType, Integer> perBackend,
        double averageConfidence,
        OffsetDateTime lastCalculatedAt
) {}

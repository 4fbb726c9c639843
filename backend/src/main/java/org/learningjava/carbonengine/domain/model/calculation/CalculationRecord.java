package org.learningjava.carbonengine.domain.model.calculation;

import java.time.OffsetDateTime;

/** A persisted calculation as read back from the store. */
public record CalculationRecord(
        Long id,
        String companyId,
        String description,
        String category,
        double quantity,
        String unit,
        String matchedFactorId,
        double emissionFactor,
        double totalEmissions,
        String emissionsUnit,
        Integer scope,
        double confidence,
        BackendType backendUsed,
        long processingTimeMs,
        OffsetDateTime createdAt
) {}

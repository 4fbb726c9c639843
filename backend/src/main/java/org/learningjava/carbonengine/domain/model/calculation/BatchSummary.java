package org.learningjava.carbonengine.domain.model.calculation;

import java.util.List;

public record BatchSummary(
        int totalEntries,
        int vectorMatched,
        int assistant,
        int demo,
        int failed,
        long totalProcessingTimeMs,
        List<ItemError> errors,
        List<CalculationResponse> results
) {

    public record ItemError(int index, String error) {}
}

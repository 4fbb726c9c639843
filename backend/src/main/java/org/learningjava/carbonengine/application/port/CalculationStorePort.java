package org.learningjava.carbonengine.application.port;

import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRecord;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.calculation.CalculationSummary;

import java.util.List;
import java.util.Optional;

public interface CalculationStorePort {
    void ensureSchema();

    // Writes (return DB id)
    long save(CalculationResult result, ParsedActivity activity, String companyId);

    // Reads
    Optional<CalculationRecord> findById(long id);

    List<CalculationRecord> listByCompany(String companyId, int limit);

    // Aggregate over every stored calculation of the company (null = all companies)
    CalculationSummary summarize(String companyId);
}

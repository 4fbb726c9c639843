package org.learningjava.carbonengine.application.usecase;

import org.learningjava.carbonengine.application.port.CalculationStorePort;
import org.learningjava.carbonengine.domain.exception.ValidationException;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRecord;
import org.learningjava.carbonengine.domain.model.calculation.CalculationSummary;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class CalculationHistoryUseCase {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final CalculationStorePort store;

    public CalculationHistoryUseCase(CalculationStorePort store) {
        this.store = store;
    }

    public List<CalculationRecord> history(String companyId, Integer limit) {
        int n = limit == null ? DEFAULT_LIMIT : limit;
        if (n <= 0) throw new ValidationException("limit must be positive");
        return store.listByCompany(companyId, Math.min(n, MAX_LIMIT));
    }

    public CalculationSummary summary(String companyId) {
        return store.summarize(companyId);
    }

    public Optional<CalculationRecord> get(long id) {
        return store.findById(id);
    }
}

package org.learningjava.carbonengine.application.usecase;

import org.learningjava.carbonengine.application.port.CalculationStorePort;
import org.learningjava.carbonengine.domain.exception.ValidationException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRequest;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResponse;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.service.normalize.ActivityNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Request entry point: normalize, run the backend chain, then persist unless in demo mode.
 * Throws {@link ValidationException} for unusable input.
 */
@Service
public class CalculateEmissionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(CalculateEmissionsUseCase.class);

    private final ActivityNormalizer normalizer;
    private final CalculationOrchestrator orchestrator;
    private final CalculationStorePort store;

    public CalculateEmissionsUseCase(ActivityNormalizer normalizer,
                                     CalculationOrchestrator orchestrator,
                                     CalculationStorePort store) {
        this.normalizer = normalizer;
        this.orchestrator = orchestrator;
        this.store = store;
    }

    public CalculationResponse handle(CalculationRequest request) {
        if (request == null) {
            throw new ValidationException("request is empty");
        }

        ParsedActivity activity;
        if (request.structured() != null) {
            activity = normalizer.normalize(request.structured());
        } else if (request.rawInput() != null && !request.rawInput().isBlank()) {
            activity = normalizer.normalize(request.rawInput());
        } else {
            throw new ValidationException("either rawInput or structured activity is required");
        }

        CalculationResult result = orchestrator.calculate(activity, request.preferredSource());

        if (request.demoMode()) {
            log.debug("Demo mode: result for '{}' not saved", activity.description());
            return CalculationResponse.ok(result, null);
        }

        try {
            long id = store.save(result, activity, request.companyId());
            log.debug("Saved calculation id={} (company={}, backend={})", id, request.companyId(), result.backendUsed());
            return CalculationResponse.ok(result, id);
        } catch (RuntimeException e) {
            log.warn("Saving calculation failed (non-fatal): {}", e.toString());
            return CalculationResponse.okWithWarning(result, "Calculation succeeded but could not be saved: " + e.getMessage());
        }
    }
}

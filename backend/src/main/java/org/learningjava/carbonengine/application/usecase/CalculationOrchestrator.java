package org.learningjava.carbonengine.application.usecase;

import org.learningjava.carbonengine.domain.exception.CalculationCancelledException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendEstimate;
import org.learningjava.carbonengine.domain.model.calculation.BackendOutcome;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.calculation.RejectionReason;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.learningjava.carbonengine.domain.service.backend.CalculationBackend;
import org.learningjava.carbonengine.domain.service.scope.ScopeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Runs a normalized activity through VECTOR_MATCH, ASSISTANT and DEMO in that order
 * and returns the first accepted estimate, with scope resolved and timing recorded.
 */
@Service
public class CalculationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CalculationOrchestrator.class);

    private final List<CalculationBackend> chain;
    private final ScopeClassifier classifier;

    public CalculationOrchestrator(List<CalculationBackend> backends, ScopeClassifier classifier) {
        Set<BackendType> seen = EnumSet.noneOf(BackendType.class);
        for (CalculationBackend b : backends) {
            if (!seen.add(b.type())) {
                throw new IllegalStateException("Duplicate backend for " + b.type());
            }
        }
        if (!seen.contains(BackendType.DEMO)) {
            throw new IllegalStateException("The chain needs a DEMO backend as its last stage");
        }
        this.chain = backends.stream()
                .sorted(Comparator.comparing(CalculationBackend::type))
                .toList();
        this.classifier = classifier;
    }

    public CalculationResult calculate(ParsedActivity activity, String preferredSource) {
        long t0 = System.nanoTime();
        List<String> fallbackReasons = new ArrayList<>();

        for (CalculationBackend backend : chain) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CalculationCancelledException("Calculation cancelled before " + backend.type(), null);
            }

            BackendOutcome outcome;
            try {
                outcome = backend.attempt(activity, preferredSource);
            } catch (CalculationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("{} failed unexpectedly: {}", backend.type(), e.toString());
                outcome = BackendOutcome.rejected(backend.type(), RejectionReason.BACKEND_UNAVAILABLE, e.getMessage());
            }

            if (outcome.isAccepted()) {
                long elapsedMs = Math.max(0L, Math.round((System.nanoTime() - t0) / 1_000_000.0));
                CalculationResult result = finish(activity, backend.type(), outcome.estimate(), elapsedMs, fallbackReasons);
                log.info("Calculated {} {} for '{}' via {} (scope={}, confidence={}, {} ms)",
                        String.format(Locale.ROOT, "%.3f", result.totalEmissions()), result.emissionsUnit(),
                        activity.description(), result.backendUsed(), result.scope().label(),
                        String.format(Locale.ROOT, "%.2f", result.confidence()), elapsedMs);
                return result;
            }

            String reason = outcome.describeRejection();
            fallbackReasons.add(reason);
            log.info("Falling back: {}", reason);
        }

        // unreachable while DEMO is in the chain
        throw new IllegalStateException("No backend accepted the activity: " + fallbackReasons);
    }

    private CalculationResult finish(ParsedActivity activity,
                                     BackendType backend,
                                     BackendEstimate estimate,
                                     long elapsedMs,
                                     List<String> fallbackReasons) {
        Scope scope = estimate.scope();
        if (scope == null) {
            scope = classify(activity, estimate.matchedFactor());
        }
        double confidence = Math.max(0.0, Math.min(1.0, estimate.confidence()));

        return new CalculationResult(
                estimate.totalEmissions(),
                estimate.emissionsUnit(),
                estimate.breakdown(),
                scope,
                confidence,
                estimate.matchedFactor(),
                estimate.alternatives() == null ? List.of() : List.copyOf(estimate.alternatives()),
                backend,
                elapsedMs,
                activity,
                estimate.convertedQuantity(),
                List.copyOf(fallbackReasons)
        );
    }

    private Scope classify(ParsedActivity activity, EmissionFactorRecord factor) {
        String activityText = factor != null && notBlank(factor.activity()) ? factor.activity() : activity.category();
        String fuel = factor != null && notBlank(factor.fuel()) ? factor.fuel() : activity.fuelType();
        String unit = factor != null && notBlank(factor.unit()) ? factor.unit() : activity.unit();
        return classifier.classify(activityText, fuel, unit, activity.description());
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}

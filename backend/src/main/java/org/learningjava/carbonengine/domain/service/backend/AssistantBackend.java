package org.learningjava.carbonengine.domain.service.backend;

import org.learningjava.carbonengine.application.port.AssistantPort;
import org.learningjava.carbonengine.application.port.AssistantPort.AssistantEstimate;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.CalculationCancelledException;
import org.learningjava.carbonengine.domain.exception.ConversionUnsupportedException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendEstimate;
import org.learningjava.carbonengine.domain.model.calculation.BackendOutcome;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.calculation.RejectionReason;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.GhgBreakdown;
import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.learningjava.carbonengine.domain.service.units.UnitConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delegates to the structured-reasoning backend. Each call is bounded by
 * {@code engine.assistant.timeout} and retried {@code engine.assistant.retries} times.
 */
@Component
public class AssistantBackend implements CalculationBackend {

    private static final Logger log = LoggerFactory.getLogger(AssistantBackend.class);

    private final AssistantPort assistant;
    private final ExecutorService executor;
    private final UnitConverter converter;
    private final EngineProperties props;

    public AssistantBackend(AssistantPort assistant,
                            @Qualifier("assistantExecutor") ExecutorService executor,
                            UnitConverter converter,
                            EngineProperties props) {
        this.assistant = assistant;
        this.executor = executor;
        this.converter = converter;
        this.props = props;
    }

    @Override
    public BackendType type() {
        return BackendType.ASSISTANT;
    }

    @Override
    public BackendOutcome attempt(ParsedActivity activity, String preferredSource) {
        EngineProperties.Assistant cfg = props.getAssistant();
        if (!cfg.isEnabled()) {
            return BackendOutcome.rejected(type(), RejectionReason.DISABLED, "assistant disabled");
        }

        List<String> hints = hints(activity);
        int attempts = 1 + Math.max(0, cfg.getRetries());
        RejectionReason lastReason = RejectionReason.BACKEND_UNAVAILABLE;
        String lastError = "no attempt made";

        for (int i = 1; i <= attempts; i++) {
            Future<AssistantEstimate> future;
            try {
                future = executor.submit(() -> assistant.structuredCalculate(activity.description(), hints));
            } catch (RejectedExecutionException e) {
                return BackendOutcome.rejected(type(), RejectionReason.BACKEND_UNAVAILABLE, "assistant pool saturated");
            }

            try {
                AssistantEstimate estimate = future.get(cfg.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
                String invalid = validate(estimate);
                if (invalid == null) {
                    return BackendOutcome.accepted(type(), toEstimate(activity, estimate));
                }
                lastReason = RejectionReason.INVALID_PAYLOAD;
                lastError = invalid;
            } catch (TimeoutException e) {
                future.cancel(true);
                lastReason = RejectionReason.BACKEND_UNAVAILABLE;
                lastError = "timed out after " + cfg.getTimeout().toMillis() + " ms";
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                lastReason = RejectionReason.BACKEND_UNAVAILABLE;
                lastError = cause.getMessage() == null ? cause.toString() : cause.getMessage();
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new CalculationCancelledException("Calculation cancelled during assistant call", e);
            }
            log.warn("Assistant attempt {}/{} failed: {}", i, attempts, lastError);
        }
        return BackendOutcome.rejected(type(), lastReason, lastError);
    }

    static List<String> hints(ParsedActivity a) {
        List<String> hints = new ArrayList<>();
        hints.add("category=" + a.category());
        if (a.subcategory() != null) hints.add("subcategory=" + a.subcategory());
        if (a.fuelType() != null) hints.add("fuel_type=" + a.fuelType());
        hints.add("quantity=" + a.quantity());
        hints.add("unit=" + a.unit());
        return hints;
    }

    private static String validate(AssistantEstimate e) {
        if (e == null) return "assistant returned no payload";
        if (!Double.isFinite(e.emissionFactor()) || e.emissionFactor() < 0) {
            return "invalid emission factor " + e.emissionFactor();
        }
        if (e.totalEmissions() != null && (!Double.isFinite(e.totalEmissions()) || e.totalEmissions() < 0)) {
            return "invalid total emissions " + e.totalEmissions();
        }
        return null;
    }

    private BackendEstimate toEstimate(ParsedActivity activity, AssistantEstimate e) {
        String factorUnit = e.emissionFactorUnit() == null || e.emissionFactorUnit().isBlank()
                ? CalculationResult.KG_CO2E + "/" + activity.unit()
                : e.emissionFactorUnit();
        Scope scope = Scope.parse(e.scope());

        EmissionFactorRecord factor = new EmissionFactorRecord(
                "assistant",
                activity.category(),
                activity.fuelType(),
                null,
                e.source() == null || e.source().isBlank() ? "ASSISTANT" : e.source(),
                factorUnit,
                e.emissionFactor(),
                scope,
                e.breakdown(),
                activity.description()
        );

        double quantity = quantityIn(activity, factor.perUnit());
        double total = e.totalEmissions() != null ? e.totalEmissions() : quantity * e.emissionFactor();
        double own = e.confidence() == null ? props.getAssistant().getDefaultConfidence() : e.confidence();
        double confidence = activity.confidence() * Math.max(0.0, Math.min(1.0, own));
        GhgBreakdown breakdown = e.breakdown() == null || e.breakdown().isEmpty() ? null : e.breakdown();

        return new BackendEstimate(total, CalculationResult.KG_CO2E, breakdown, scope, confidence,
                factor, List.of(), quantity);
    }

    // the assistant usually answers per activity unit; convert when it didn't
    private double quantityIn(ParsedActivity activity, String perUnit) {
        try {
            return converter.convert(activity.quantity(), activity.unit(), perUnit);
        } catch (ConversionUnsupportedException ex) {
            return activity.quantity();
        }
    }
}

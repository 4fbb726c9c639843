package org.learningjava.carbonengine.domain.service.backend;

import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.exception.ConversionUnsupportedException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendEstimate;
import org.learningjava.carbonengine.domain.model.calculation.BackendOutcome;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.calculation.RejectionReason;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.GhgBreakdown;
import org.learningjava.carbonengine.domain.model.factor.MatchCandidate;
import org.learningjava.carbonengine.domain.service.matching.EmissionFactorMatcher;
import org.learningjava.carbonengine.domain.service.units.UnitConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class VectorMatchBackend implements CalculationBackend {

    private static final Logger log = LoggerFactory.getLogger(VectorMatchBackend.class);

    private final EmissionFactorMatcher matcher;
    private final UnitConverter converter;
    private final EngineProperties props;

    public VectorMatchBackend(EmissionFactorMatcher matcher, UnitConverter converter, EngineProperties props) {
        this.matcher = matcher;
        this.converter = converter;
        this.props = props;
    }

    @Override
    public BackendType type() {
        return BackendType.VECTOR_MATCH;
    }

    @Override
    public BackendOutcome attempt(ParsedActivity activity, String preferredSource) {
        List<MatchCandidate> matches;
        try {
            matches = matcher.match(activity, props.getMatcher().getMaxResults(), preferredSource);
        } catch (BackendUnavailableException e) {
            return BackendOutcome.rejected(type(), RejectionReason.BACKEND_UNAVAILABLE, e.getMessage());
        }

        if (matches.isEmpty()) {
            return BackendOutcome.rejected(type(), RejectionReason.NO_MATCH_FOUND,
                    "no factor above " + props.getMatcher().getMinSimilarity());
        }

        MatchCandidate best = matches.get(0);
        // never accept below the matcher floor, whatever the threshold says
        double threshold = Math.max(props.getMatcher().getAcceptThreshold(), props.getMatcher().getMinSimilarity());
        if (best.similarity() < threshold) {
            return BackendOutcome.rejected(type(), RejectionReason.LOW_SIMILARITY,
                    String.format(Locale.ROOT, "best similarity %.3f < %.2f", best.similarity(), threshold));
        }

        EmissionFactorRecord factor = best.factor();
        if (!Double.isFinite(factor.value()) || factor.value() < 0) {
            return BackendOutcome.rejected(type(), RejectionReason.INVALID_PAYLOAD,
                    "factor " + factor.id() + " has value " + factor.value());
        }

        double converted;
        try {
            converted = converter.convert(activity.quantity(), activity.unit(), factor.perUnit());
        } catch (ConversionUnsupportedException e) {
            log.info("Factor {} expects '{}', activity is in '{}'; leaving unconverted",
                    factor.id(), factor.perUnit(), activity.unit());
            return BackendOutcome.rejected(type(), RejectionReason.CONVERSION_UNSUPPORTED,
                    "unconverted " + activity.quantity() + " " + activity.unit() + " -> " + factor.perUnit());
        }

        double total = converted * factor.value();
        GhgBreakdown breakdown = factor.ghgBreakdown() == null || factor.ghgBreakdown().isEmpty()
                ? null
                : factor.ghgBreakdown().scale(converted);
        double confidence = activity.confidence() * best.similarity();

        if (best.similarity() >= props.getMatcher().getHighConfidence()) {
            log.info("High-confidence match {} (similarity={})", factor.id(), best.similarity());
        } else {
            log.info("Accepted match {} below high-confidence mark (similarity={})", factor.id(), best.similarity());
        }

        return BackendOutcome.accepted(type(), new BackendEstimate(
                total,
                CalculationResult.KG_CO2E,
                breakdown,
                factor.scope(),
                confidence,
                factor,
                matches.subList(1, matches.size()),
                converted
        ));
    }
}

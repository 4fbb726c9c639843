package org.learningjava.carbonengine.domain.service.backend;

import org.learningjava.carbonengine.domain.exception.ConversionUnsupportedException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendEstimate;
import org.learningjava.carbonengine.domain.model.calculation.BackendOutcome;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.service.units.UnitConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Last stage of the chain. Always accepts, with a low confidence and the
 * table's own scope.
 */
@Component
public class DemoBackend implements CalculationBackend {

    private static final Logger log = LoggerFactory.getLogger(DemoBackend.class);

    static final double CONFIDENCE_FACTOR = 0.3;

    private final UnitConverter converter;

    public DemoBackend(UnitConverter converter) {
        this.converter = converter;
    }

    @Override
    public BackendType type() {
        return BackendType.DEMO;
    }

    @Override
    public BackendOutcome attempt(ParsedActivity activity, String preferredSource) {
        DemoFactorTable.Entry entry = DemoFactorTable.lookup(activity);

        double quantity;
        try {
            quantity = converter.convert(activity.quantity(), activity.unit(), entry.unit());
        } catch (ConversionUnsupportedException e) {
            quantity = activity.quantity();
        }

        EmissionFactorRecord factor = new EmissionFactorRecord(
                "demo:" + entry.category(),
                entry.category(),
                null,
                null,
                "DEMO",
                CalculationResult.KG_CO2E + "/" + entry.unit(),
                entry.value(),
                entry.scope(),
                null,
                "Illustrative " + entry.category() + " factor"
        );

        if (log.isDebugEnabled()) {
            log.debug("Demo factor {} applied to {} {}", factor.id(), activity.quantity(), activity.unit());
        }

        return BackendOutcome.accepted(type(), new BackendEstimate(
                quantity * entry.value(),
                CalculationResult.KG_CO2E,
                null,
                entry.scope(),
                activity.confidence() * CONFIDENCE_FACTOR,
                factor,
                List.of(),
                quantity
        ));
    }
}

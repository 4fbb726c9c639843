package org.learningjava.carbonengine.domain.service.backend;

import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendOutcome;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;

/**
 * One stage of the fallback chain. Implementations must not throw for expected
 * failures (no match, timeout, bad payload); they return a rejection instead.
 */
public interface CalculationBackend {

    BackendType type();

    BackendOutcome attempt(ParsedActivity activity, String preferredSource);
}

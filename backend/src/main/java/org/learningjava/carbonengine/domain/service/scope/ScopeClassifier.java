package org.learningjava.carbonengine.domain.service.scope;

import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assigns a GHG scope with producer-vs-consumer semantics.
 * <p>
 * Rules are evaluated top to bottom and the first match wins. The order is part of the
 * contract: several rules overlap (e.g. "company vehicle transport" satisfies both
 * {@code COMPANY_OWNED_ASSETS} and {@code TRANSPORT_TRAVEL}).
 */
@Component
public class ScopeClassifier {

    private static final Logger log = LoggerFactory.getLogger(ScopeClassifier.class);

    public static final String RULESET_VERSION = "1.0";
    public static final String DEFAULT_RULE = "DEFAULT_DIRECT_COMBUSTION";

    // Dutch variants included: stroom, elektriciteit
    static final String[] ELECTRICITY_FUELS = {"electricity", "grid", "stroom", "elektriciteit"};

    private static final List<ScopeRule> RULES = List.of(
            new ScopeRule("PRODUCER_GENERATION", s ->
                    s.activityHas("electricity generation", "electricity and heat production",
                            "main activity electricity", "energy industries", "power plant")
                            || s.descriptionHas("electricity generation", "power plant",
                            "electricity and heat production"),
                    Scope.SCOPE_1),

            new ScopeRule("DIRECT_COMBUSTION", s ->
                    s.descriptionHas("fuel combustion activities", "combustion", "burning")
                            && !s.descriptionHas("purchased")
                            && !s.descriptionHas("grid")
                            && s.unitHas("tj/kt", "kg/tj", "g/kg", "g/mj"),
                    Scope.SCOPE_1),

            new ScopeRule("COMPANY_OWNED_ASSETS", s ->
                    s.activityHas("company owned", "fleet")
                            || (s.activityHas("vehicle") && s.descriptionHas("company")),
                    Scope.SCOPE_1),

            // "kg co2e/unit" only counts together with an electricity fuel
            new ScopeRule("PURCHASED_ELECTRICITY", s ->
                    s.fuelHas(ELECTRICITY_FUELS)
                            || s.descriptionHas("grid mix", "purchased electricity", "electricity consumption",
                            "stroomverbruik")
                            || s.unitHas("kg co2e/kwh", "kg co2e/mwh")
                            || (s.unitHas("kg co2e/unit") && s.fuelHas("electricity")),
                    Scope.SCOPE_2),

            new ScopeRule("PURCHASED_HEAT_STEAM_COOLING", s ->
                    s.descriptionHas("district heat", "steam purchased", "purchased steam",
                            "purchased heat", "purchased cooling"),
                    Scope.SCOPE_2),

            new ScopeRule("TRANSPORT_TRAVEL", s ->
                    s.descriptionHas("transport", "travel", "flight", "passenger")
                            || s.activityHas("transport", "travel", "aviation")
                            || (s.activityHas("vehicle") && !s.descriptionHas("company")),
                    Scope.SCOPE_3),

            new ScopeRule("WASTE", s ->
                    s.descriptionHas("waste", "recycling", "landfill")
                            || s.activityHas("waste"),
                    Scope.SCOPE_3)
    );

    public Scope classify(String activity, String fuel, String unit, String description) {
        ScopeRule rule = firstMatch(ScopeSignals.of(activity, fuel, unit, description));
        return rule == null ? Scope.SCOPE_1 : rule.scope();
    }

    /** Name of the rule that fires, {@link #DEFAULT_RULE} when none does. */
    public String explain(String activity, String fuel, String unit, String description) {
        ScopeRule rule = firstMatch(ScopeSignals.of(activity, fuel, unit, description));
        return rule == null ? DEFAULT_RULE : rule.name();
    }

    public List<ScopeRule> rules() {
        return RULES;
    }

    private ScopeRule firstMatch(ScopeSignals signals) {
        for (ScopeRule rule : RULES) {
            if (rule.matches(signals)) {
                if (log.isTraceEnabled()) log.trace("Scope rule {} matched {}", rule.name(), signals);
                return rule;
            }
        }
        return null;
    }
}

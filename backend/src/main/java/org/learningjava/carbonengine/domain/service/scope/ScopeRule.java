package org.learningjava.carbonengine.domain.service.scope;

import org.learningjava.carbonengine.domain.model.factor.Scope;

import java.util.function.Predicate;

public record ScopeRule(String name, Predicate<ScopeSignals> predicate, Scope scope) {

    public boolean matches(ScopeSignals signals) {
        return predicate.test(signals);
    }
}

package org.learningjava.carbonengine.infrastructure.adapter.in.web;

import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.learningjava.carbonengine.domain.service.scope.ScopeClassifier;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/scopes")
public class ScopeController {

    public record ClassifyRequest(String activity, String fuel, String unit, String description) {}

    public record ClassifyResponse(Scope scope, String label, String rule, String rulesetVersion) {}

    private final ScopeClassifier classifier;

    public ScopeController(ScopeClassifier classifier) {
        this.classifier = classifier;
    }

    @PostMapping("/classify")
    public ClassifyResponse classify(@RequestBody ClassifyRequest req) {
        Scope scope = classifier.classify(req.activity(), req.fuel(), req.unit(), req.description());
        String rule = classifier.explain(req.activity(), req.fuel(), req.unit(), req.description());
        return new ClassifyResponse(scope, scope.label(), rule, ScopeClassifier.RULESET_VERSION);
    }
}

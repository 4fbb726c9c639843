package org.learningjava.carbonengine.infrastructure.adapter.in.web;

import org.learningjava.carbonengine.application.usecase.CalculateEmissionsUseCase;
import org.learningjava.carbonengine.application.usecase.CalculationHistoryUseCase;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRecord;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRequest;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResponse;
import org.learningjava.carbonengine.domain.model.calculation.CalculationSummary;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/calculations")
public class CalculationController {

    private final CalculateEmissionsUseCase calculate;
    private final CalculationHistoryUseCase history;

    public CalculationController(CalculateEmissionsUseCase calculate, CalculationHistoryUseCase history) {
        this.calculate = calculate;
        this.history = history;
    }

    @PostMapping
    public CalculationResponse calculate(@RequestBody CalculationRequest request) {
        return calculate.handle(request);
    }

    @GetMapping
    public List<CalculationRecord> list(@RequestParam(required = false) String companyId,
                                        @RequestParam(required = false) Integer limit) {
        return history.history(companyId, limit);
    }

    @GetMapping("/summary")
    public CalculationSummary summary(@RequestParam(required = false) String companyId) {
        return history.summary(companyId);
    }

    @GetMapping("/{id:\\d+}")
    public CalculationRecord get(@PathVariable("id") long id) {
        return history.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No calculation " + id));
    }
}

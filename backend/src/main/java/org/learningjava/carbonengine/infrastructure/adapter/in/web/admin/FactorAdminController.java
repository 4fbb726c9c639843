package org.learningjava.carbonengine.infrastructure.adapter.in.web.admin;

import org.learningjava.carbonengine.application.port.FactorStorePort;
import org.learningjava.carbonengine.application.usecase.FactorIngestionUseCase;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/factors")
public class FactorAdminController {

    private final FactorIngestionUseCase ingestion;
    private final FactorStorePort store;

    public FactorAdminController(FactorIngestionUseCase ingestion, FactorStorePort store) {
        this.ingestion = ingestion;
        this.store = store;
    }

    // location: classpath:... or file:...; defaults to engine.factors.seed-file
    @PostMapping("/ingest")
    public Map<String, Object> ingest(@RequestParam(required = false) String location) {
        int n = (location == null || location.isBlank())
                ? ingestion.ingestDefault()
                : ingestion.ingest(location);
        return Map.of("ingested", n, "total", store.count());
    }

    @GetMapping("/count")
    public Map<String, Object> count() {
        return Map.of("total", store.count());
    }
}

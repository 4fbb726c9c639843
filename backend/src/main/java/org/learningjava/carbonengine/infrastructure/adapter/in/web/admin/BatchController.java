package org.learningjava.carbonengine.infrastructure.adapter.in.web.admin;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import org.learningjava.carbonengine.application.usecase.BatchRecalculationUseCase;
import org.learningjava.carbonengine.domain.model.calculation.BatchSummary;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

@RestController
@RequestMapping("/calculations/batch")
public class BatchController {

    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    public record BatchRequest(@NotEmpty List<CalculationRequest> items) {}

    private final BatchRecalculationUseCase batch;
    private final JobRegistry jobs;
    private final Executor executor;

    public BatchController(BatchRecalculationUseCase batch,
                           JobRegistry jobs,
                           @Qualifier("applicationTaskExecutor") Executor executor) {
        this.batch = batch;
        this.jobs = jobs;
        this.executor = executor;
    }

    @PostMapping
    public Map<String, Object> submit(@Valid @RequestBody BatchRequest request) {
        List<CalculationRequest> items = request.items();
        String jobId = jobs.start("BATCH", items.size());

        executor.execute(() -> {
            try {
                log.info("[{}] Batch start: {} items", jobId, items.size());
                BatchSummary summary = batch.run(items, (processed, message) -> jobs.update(jobId, processed, message));
                jobs.done(jobId, "Processed " + summary.totalEntries() + " items, " + summary.failed() + " failed", summary);
                log.info("[{}] Batch done", jobId);
            } catch (Exception e) {
                jobs.fail(jobId, e.getMessage());
                log.error("[{}] Batch failed: {}", jobId, e.toString(), e);
            }
        });

        return Map.of("jobId", jobId);
    }

    @GetMapping("/{id}")
    public JobRegistry.JobStatus status(@PathVariable("id") String id) {
        JobRegistry.JobStatus status = jobs.get(id);
        if (status == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown batch job: " + id);
        }
        return status;
    }
}

package org.learningjava.carbonengine.application.usecase;

import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.CalculationCancelledException;
import org.learningjava.carbonengine.domain.model.calculation.BatchSummary;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRequest;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Recalculates a list of activities in chunks, pausing between chunks.
 * A failing item is recorded in the summary and the batch carries on.
 */
@Service
public class BatchRecalculationUseCase {

    private static final Logger log = LoggerFactory.getLogger(BatchRecalculationUseCase.class);

    @FunctionalInterface
    interface Pause {
        void sleep(Duration d) throws InterruptedException;
    }

    private final CalculateEmissionsUseCase calculate;
    private final EngineProperties props;
    private final Pause pause;

    @Autowired
    public BatchRecalculationUseCase(CalculateEmissionsUseCase calculate, EngineProperties props) {
        this(calculate, props, d -> Thread.sleep(d.toMillis()));
    }

    BatchRecalculationUseCase(CalculateEmissionsUseCase calculate, EngineProperties props, Pause pause) {
        this.calculate = calculate;
        this.props = props;
        this.pause = pause;
    }

    public BatchSummary run(List<CalculationRequest> items) {
        return run(items, (processed, message) -> { });
    }

    /**
     * @param progress receives (processed count, message) after every chunk
     */
    public BatchSummary run(List<CalculationRequest> items, BiConsumer<Integer, String> progress) {
        List<CalculationRequest> all = items == null ? List.of() : items;
        int chunkSize = Math.max(1, props.getBatch().getChunkSize());
        Duration gap = props.getBatch().getPause();

        int vector = 0, assistant = 0, demo = 0, failed = 0;
        long totalMs = 0;
        List<BatchSummary.ItemError> errors = new ArrayList<>();
        List<CalculationResponse> results = new ArrayList<>(all.size());

        for (int start = 0; start < all.size(); start += chunkSize) {
            if (start > 0 && gap != null && !gap.isZero() && !gap.isNegative()) {
                try {
                    pause.sleep(gap);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CalculationCancelledException("Batch cancelled after " + start + " items", e);
                }
            }

            int end = Math.min(all.size(), start + chunkSize);
            for (int i = start; i < end; i++) {
                CalculationResponse response;
                try {
                    response = calculate.handle(all.get(i));
                } catch (CalculationCancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Batch item {} failed: {}", i, e.getMessage());
                    response = CalculationResponse.failed(e.getMessage());
                }
                results.add(response);

                if (!response.success() || response.calculation() == null) {
                    failed++;
                    errors.add(new BatchSummary.ItemError(i, response.error()));
                    continue;
                }
                totalMs += response.calculation().processingTimeMs();
                switch (response.calculation().backendUsed()) {
                    case VECTOR_MATCH -> vector++;
                    case ASSISTANT -> assistant++;
                    case DEMO -> demo++;
                }
            }
            progress.accept(end, "Processed " + end + "/" + all.size());
        }

        log.info("Batch done: {} items ({} vector, {} assistant, {} demo, {} failed)",
                all.size(), vector, assistant, demo, failed);
        return new BatchSummary(all.size(), vector, assistant, demo, failed, totalMs,
                List.copyOf(errors), List.copyOf(results));
    }
}

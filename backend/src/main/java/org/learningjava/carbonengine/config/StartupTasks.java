package org.learningjava.carbonengine.config;

import org.learningjava.carbonengine.application.port.CalculationStorePort;
import org.learningjava.carbonengine.application.usecase.FactorIngestionUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class StartupTasks implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final CalculationStorePort calculations;
    private final FactorIngestionUseCase ingestion;
    private final EngineProperties props;
    private final TaskExecutor executor;

    public StartupTasks(CalculationStorePort calculations,
                        FactorIngestionUseCase ingestion,
                        EngineProperties props,
                        @Qualifier("applicationTaskExecutor") TaskExecutor executor) {
        this.calculations = calculations;
        this.ingestion = ingestion;
        this.props = props;
        this.executor = executor;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("=== StartupTasks BEGIN ===");
        CompletableFuture
                .runAsync(this::prepareCalculationStore, executor)
                .thenRunAsync(this::loadFactors, executor)
                .whenComplete((v, e) -> log.info("=== StartupTasks END ==="));
    }

    private void prepareCalculationStore() {
        try {
            calculations.ensureSchema();
        } catch (RuntimeException e) {
            // calculations still work; saving them will report a warning
            log.error("Calculation store not ready: {}", e.toString());
        }
    }

    private void loadFactors() {
        if (!props.getFactors().isLoadOnStartup()) {
            log.info("Factor loading disabled (engine.factors.load-on-startup=false)");
            return;
        }
        try {
            int n = ingestion.ingestDefault();
            log.info("Loaded {} emission factors from {}", n, props.getFactors().getSeedFile());
        } catch (RuntimeException e) {
            log.error("Loading emission factors from {} failed", props.getFactors().getSeedFile(), e);
        }
    }
}

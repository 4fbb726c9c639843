package org.learningjava.carbonengine.config;

import org.learningjava.carbonengine.application.port.CalculationStorePort;
import org.learningjava.carbonengine.application.port.EmbeddingPort;
import org.learningjava.carbonengine.application.port.FactorStorePort;
import org.learningjava.carbonengine.infrastructure.adapter.out.memory.InMemoryFactorStoreAdapter;
import org.learningjava.carbonengine.infrastructure.adapter.out.ollama.OllamaEmbeddingAdapter;
import org.learningjava.carbonengine.infrastructure.adapter.out.postgres.PostgresCalculationStoreAdapter;
import org.learningjava.carbonengine.infrastructure.adapter.out.weaviate.WeaviateFactorStoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Locale;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    //objects with external dependencies
    @Bean
    EmbeddingPort embedding(@Value("${carbonengine.ollama.url}") String url,
                            @Value("${carbonengine.ollama.embeddingModel}") String model) {
        return new OllamaEmbeddingAdapter(url, model);
    }

    @Bean
    FactorStorePort factorStore(EngineProperties props,
                                @Value("${carbonengine.weaviate.url:http://weaviate:8080}") String url,
                                @Value("${carbonengine.weaviate.apiKey:}") String apiKey,
                                @Value("${carbonengine.weaviate.className:EmissionFactor}") String className) {
        String kind = props.getFactors().getStore().toLowerCase(Locale.ROOT);
        log.info("Emission factor store: {}", kind);
        return switch (kind) {
            case "weaviate" -> new WeaviateFactorStoreAdapter(url, apiKey, className);
            case "memory" -> new InMemoryFactorStoreAdapter();
            default -> throw new IllegalStateException("Unknown engine.factors.store: " + kind);
        };
    }

    @Bean
    CalculationStorePort calculationStore(DataSource dataSource) {
        return new PostgresCalculationStoreAdapter(dataSource);
    }
}

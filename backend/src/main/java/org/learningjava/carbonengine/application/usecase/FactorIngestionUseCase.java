package org.learningjava.carbonengine.application.usecase;

import org.learningjava.carbonengine.application.port.EmbeddingPort;
import org.learningjava.carbonengine.application.port.FactorSeedReaderPort;
import org.learningjava.carbonengine.application.port.FactorStorePort;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class FactorIngestionUseCase {

    private static final Logger log = LoggerFactory.getLogger(FactorIngestionUseCase.class);

    private final FactorSeedReaderPort reader;
    private final FactorStorePort store;
    private final EmbeddingPort embedding;
    private final EngineProperties props;

    public FactorIngestionUseCase(FactorSeedReaderPort reader,
                                  FactorStorePort store,
                                  EmbeddingPort embedding,
                                  EngineProperties props) {
        this.reader = reader;
        this.store = store;
        this.embedding = embedding;
        this.props = props;
    }

    /** Loads the configured seed file. */
    public int ingestDefault() {
        return ingest(props.getFactors().getSeedFile());
    }

    public int ingest(String location) {
        List<EmissionFactorRecord> factors = reader.read(location);
        if (factors.isEmpty()) {
            log.warn("No emission factors found in {}", location);
            return 0;
        }

        store.ensureSchema();
        List<float[]> vectors = embedAll(factors);
        store.upsertFactors(factors, vectors);
        log.info("Ingested {} emission factors from {} (store now holds {})", factors.size(), location, store.count());
        return factors.size();
    }

    // Without embeddings the factors are still stored; matching then runs on terms only
    private List<float[]> embedAll(List<EmissionFactorRecord> factors) {
        List<String> texts = factors.stream().map(EmissionFactorRecord::searchText).toList();
        try {
            List<float[]> vectors = embedding.embedBatch(texts);
            if (vectors != null && vectors.size() == factors.size()) {
                return vectors;
            }
            log.warn("Embedding returned {} vectors for {} factors; storing without vectors",
                    vectors == null ? 0 : vectors.size(), factors.size());
        } catch (RuntimeException e) {
            log.warn("Embedding factors with {} failed, storing without vectors: {}", embedding.model(), e.toString());
        }
        List<float[]> empty = new ArrayList<>(factors.size());
        for (int i = 0; i < factors.size(); i++) empty.add(new float[0]);
        return empty;
    }
}

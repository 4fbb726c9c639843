package org.learningjava.carbonengine.infrastructure.adapter.out.memory;

import org.learningjava.carbonengine.application.port.FactorStorePort;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.MatchCandidate;
import org.learningjava.carbonengine.domain.service.matching.Similarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToDoubleFunction;

/**
 * Factor store kept in memory. Readers always see one complete, immutable snapshot;
 * an upsert builds a new snapshot and swaps it in. Ties keep dataset order.
 */
public class InMemoryFactorStoreAdapter implements FactorStorePort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFactorStoreAdapter.class);

    private record Entry(EmissionFactorRecord factor, float[] vector) {
        boolean embedded() {
            return vector.length > 0;
        }
    }

    private final AtomicReference<List<Entry>> snapshot = new AtomicReference<>(List.of());

    @Override
    public void ensureSchema() {
        // nothing to create
    }

    @Override
    public synchronized void upsertFactors(List<EmissionFactorRecord> factors, List<float[]> vectors) {
        if (factors == null || factors.isEmpty()) return;
        if (vectors == null || vectors.size() != factors.size()) {
            throw new IllegalArgumentException("factors and vectors must have same size");
        }

        Map<String, Entry> byId = new LinkedHashMap<>();
        for (Entry e : snapshot.get()) byId.put(e.factor().id(), e);
        for (int i = 0; i < factors.size(); i++) {
            float[] v = vectors.get(i);
            byId.put(factors.get(i).id(), new Entry(factors.get(i), v == null ? new float[0] : v.clone()));
        }
        snapshot.set(List.copyOf(byId.values()));
        log.info("In-memory factor store now holds {} factors", byId.size());
    }

    @Override
    public List<MatchCandidate> nearestByVector(float[] queryVec, double minSimilarity, int maxResults) {
        List<Entry> embedded = snapshot.get().stream().filter(Entry::embedded).toList();
        return rank(embedded, e -> Similarity.cosine(queryVec, e.vector()), minSimilarity, maxResults);
    }

    @Override
    public List<MatchCandidate> searchByTerms(List<String> terms, double minSimilarity, int maxResults) {
        return rank(snapshot.get(), e -> Similarity.termScore(e.factor(), terms), minSimilarity, maxResults);
    }

    @Override
    public List<MatchCandidate> searchUnembeddedByTerms(List<String> terms, double minSimilarity, int maxResults) {
        List<Entry> unembedded = snapshot.get().stream().filter(e -> !e.embedded()).toList();
        return rank(unembedded, e -> Similarity.termScore(e.factor(), terms), minSimilarity, maxResults);
    }

    @Override
    public int count() {
        return snapshot.get().size();
    }

    private static List<MatchCandidate> rank(List<Entry> entries,
                                             ToDoubleFunction<Entry> score,
                                             double minSimilarity,
                                             int maxResults) {
        if (maxResults <= 0) return List.of();
        List<MatchCandidate> hits = new ArrayList<>();
        for (Entry e : entries) {
            double s = score.applyAsDouble(e);
            if (s >= minSimilarity) hits.add(new MatchCandidate(e.factor(), s));
        }
        // List.sort is stable, so equal scores stay in dataset order
        hits.sort(Comparator.comparingDouble(MatchCandidate::similarity).reversed());
        return List.copyOf(hits.subList(0, Math.min(maxResults, hits.size())));
    }
}

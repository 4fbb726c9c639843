package org.learningjava.carbonengine.application.port;

import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.MatchCandidate;

import java.util.List;

/**
 * Read-mostly access to the reference emission-factor dataset.
 * Query methods never mutate the dataset and may be called concurrently.
 */
public interface FactorStorePort {
    void ensureSchema();

    void upsertFactors(List<EmissionFactorRecord> factors, List<float[]> vectors);

    // Candidates with similarity >= minSimilarity, best first, at most maxResults
    List<MatchCandidate> nearestByVector(float[] queryVec, double minSimilarity, int maxResults);

    // Degraded mode: categorical exact/partial matching on activity, fuel and description
    List<MatchCandidate> searchByTerms(List<String> terms, double minSimilarity, int maxResults);

    // Term matching restricted to factors stored without a vector (ingested while embedding was down)
    List<MatchCandidate> searchUnembeddedByTerms(List<String> terms, double minSimilarity, int maxResults);

    int count();
}

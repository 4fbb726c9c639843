package org.learningjava.carbonengine.domain.service.matching;

import org.learningjava.carbonengine.application.port.EmbeddingPort;
import org.learningjava.carbonengine.application.port.FactorStorePort;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.exception.NoMatchFoundException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.factor.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks reference factors against an activity.
 * <p>
 * Vector similarity is the primary mode; factors stored without a vector are term-scored
 * alongside it. When the embedding backend is down the matcher degrades to categorical term
 * matching against the whole store.
 * Results are ordered by similarity (descending); ties go to the preferred source, then to
 * dataset order. Anything below {@code engine.matcher.min-similarity} is dropped.
 */
@Service
public class EmissionFactorMatcher {

    private static final Logger log = LoggerFactory.getLogger(EmissionFactorMatcher.class);

    private final EmbeddingPort embedding;
    private final FactorStorePort store;
    private final EngineProperties props;

    public EmissionFactorMatcher(EmbeddingPort embedding, FactorStorePort store, EngineProperties props) {
        this.embedding = embedding;
        this.store = store;
        this.props = props;
    }

    public List<MatchCandidate> match(ParsedActivity activity, int maxResults) {
        return match(activity, maxResults, null);
    }

    public List<MatchCandidate> match(ParsedActivity activity, int maxResults, String preferredSource) {
        if (maxResults <= 0) return List.of();
        double floor = props.getMatcher().getMinSimilarity();

        List<MatchCandidate> raw;
        float[] qVec = embedQuietly(activity);
        List<String> terms = QueryTerms.matchTerms(activity);
        try {
            if (qVec != null) {
                raw = new ArrayList<>(store.nearestByVector(qVec, floor, maxResults));
                // factors ingested while embedding was down have no vector; they compete on terms
                raw.addAll(store.searchUnembeddedByTerms(terms, floor, maxResults));
            } else {
                log.info("Embedding unavailable, matching on terms {}", terms);
                raw = store.searchByTerms(terms, floor, maxResults);
            }
        } catch (RuntimeException e) {
            throw new BackendUnavailableException("Factor store query failed: " + e.getMessage(), e);
        }

        List<MatchCandidate> ranked = rank(raw, floor, preferredSource);
        List<MatchCandidate> out = ranked.size() > maxResults ? ranked.subList(0, maxResults) : ranked;

        if (out.isEmpty()) {
            log.warn("No factor above {} for '{}'", floor, activity.description());
        } else if (log.isDebugEnabled()) {
            log.debug("Best factor for '{}': {} (similarity={})",
                    activity.description(), out.get(0).factor().id(), out.get(0).similarity());
        }
        return List.copyOf(out);
    }

    /** First result or {@link NoMatchFoundException}. */
    public MatchCandidate bestMatch(ParsedActivity activity, String preferredSource) {
        List<MatchCandidate> results = match(activity, 1, preferredSource);
        if (results.isEmpty()) {
            throw new NoMatchFoundException("No emission factor matches '" + activity.description() + "'");
        }
        return results.get(0);
    }

    static List<MatchCandidate> rank(List<MatchCandidate> raw, double floor, String preferredSource) {
        if (raw == null || raw.isEmpty()) return List.of();

        List<MatchCandidate> kept = new ArrayList<>(raw.size());
        for (MatchCandidate c : raw) {
            if (c == null || c.factor() == null) continue;
            double sim = Math.max(0.0, Math.min(1.0, c.similarity()));
            if (sim >= floor) kept.add(sim == c.similarity() ? c : new MatchCandidate(c.factor(), sim));
        }

        // List.sort is stable, so equal keys keep dataset order
        Comparator<MatchCandidate> bySimilarity = Comparator.comparingDouble(MatchCandidate::similarity).reversed();
        kept.sort(bySimilarity.thenComparing(c -> isPreferred(c, preferredSource) ? 0 : 1));
        return kept;
    }

    private static boolean isPreferred(MatchCandidate c, String preferredSource) {
        return preferredSource != null && !preferredSource.isBlank()
                && c.factor().source() != null
                && c.factor().source().equalsIgnoreCase(preferredSource.trim());
    }

    private float[] embedQuietly(ParsedActivity activity) {
        String text = QueryTerms.embeddingText(activity);
        try {
            float[] v = embedding.embed(text);
            if (v == null || v.length == 0) {
                log.warn("Embedding returned empty vector for '{}'", text);
                return null;
            }
            return v;
        } catch (RuntimeException e) {
            log.warn("Embedding failed for '{}': {}", text, e.getMessage());
            return null;
        }
    }
}

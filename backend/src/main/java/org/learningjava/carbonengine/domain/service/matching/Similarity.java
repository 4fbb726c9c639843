package org.learningjava.carbonengine.domain.service.matching;

import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;

import java.util.List;
import java.util.Locale;

/** Similarity scores in [0,1] shared by the factor stores. */
public final class Similarity {

    static final double EXACT = 0.80;
    static final double PARTIAL = 0.65;
    static final double DESCRIPTION_ONLY = 0.50;
    static final double COVERAGE_WEIGHT = 0.20;

    private Similarity() {}

    /** Cosine similarity clamped to [0,1]; 0 for empty or mismatched vectors. */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) return 0.0;
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        double c = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return Math.max(0.0, Math.min(1.0, c));
    }

    /**
     * Categorical score of a factor against lower-case query terms.
     * A term equal to the factor's activity or fuel scores {@link #EXACT}, a term inside them
     * {@link #PARTIAL}, a term only in the description {@link #DESCRIPTION_ONLY}; the share of
     * terms found anywhere adds up to {@link #COVERAGE_WEIGHT}.
     */
    public static double termScore(EmissionFactorRecord f, List<String> terms) {
        if (terms == null || terms.isEmpty()) return 0.0;
        String activity = lower(f.activity());
        String fuel = lower(f.fuel());
        String description = lower(f.description());

        double base = 0.0;
        int found = 0;
        for (String t : terms) {
            if (t == null || t.isBlank()) continue;
            String term = t.toLowerCase(Locale.ROOT);
            double s;
            if (term.equals(activity) || term.equals(fuel)) s = EXACT;
            else if (activity.contains(term) || fuel.contains(term)) s = PARTIAL;
            else if (description.contains(term)) s = DESCRIPTION_ONLY;
            else continue;
            found++;
            base = Math.max(base, s);
        }
        if (found == 0) return 0.0;
        return Math.min(1.0, base + COVERAGE_WEIGHT * found / terms.size());
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}

package org.learningjava.carbonengine.domain.model.factor;

/** Per-gas split in kg. Any gas may be unknown (null). */
public record GhgBreakdown(Double co2, Double ch4, Double n2o) {

    public static GhgBreakdown empty() {
        return new GhgBreakdown(null, null, null);
    }

    public boolean isEmpty() {
        return co2 == null && ch4 == null && n2o == null;
    }

    public GhgBreakdown scale(double factor) {
        return new GhgBreakdown(
                co2 == null ? null : co2 * factor,
                ch4 == null ? null : ch4 * factor,
                n2o == null ? null : n2o * factor
        );
    }
}

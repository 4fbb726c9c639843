package org.learningjava.carbonengine.domain.model.factor;

/**
 * One row of the reference emission-factor dataset. {@code value} is kg CO2e per {@link #perUnit()}.
 * {@code scope} and {@code ghgBreakdown} may be null.
 */
public record EmissionFactorRecord(
        String id,
        String activity,
        String fuel,
        String region,
        String source,
        String unit,
        double value,
        Scope scope,
        GhgBreakdown ghgBreakdown,
        String description
) {

    /** Unit the factor applies per: "kg CO2e/kWh" -> "kWh", "L" -> "L". */
    public String perUnit() {
        if (unit == null) return "";
        int slash = unit.lastIndexOf('/');
        return (slash >= 0 ? unit.substring(slash + 1) : unit).trim();
    }

    /** Text used to build the factor's embedding and for term matching. */
    public String searchText() {
        StringBuilder sb = new StringBuilder();
        append(sb, activity);
        append(sb, fuel);
        append(sb, description);
        append(sb, unit);
        return sb.toString().trim();
    }

    private static void append(StringBuilder sb, String s) {
        if (s != null && !s.isBlank()) sb.append(s).append(' ');
    }
}

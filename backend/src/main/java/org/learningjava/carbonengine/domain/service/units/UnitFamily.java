package org.learningjava.carbonengine.domain.service.units;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Disjoint unit families. Every member stores its multiplier to the family's base unit.
 * Keys are lower-case and trimmed.
 */
public enum UnitFamily {

    ENERGY("kwh", table(
            "kwh", 1.0,
            "mwh", 1_000.0,
            "gwh", 1_000_000.0,
            "wh", 0.001,
            "j", 2.77778e-7,
            "kj", 0.000277778,
            "mj", 0.277778,
            "gj", 277.778,
            "tj", 277_778.0,
            "btu", 0.000293071,
            "therm", 29.3071
    )),

    VOLUME("l", table(
            "l", 1.0,
            "liter", 1.0,
            "liters", 1.0,
            "litre", 1.0,
            "litres", 1.0,
            "ml", 0.001,
            "m3", 1_000.0,
            "cm3", 0.001,
            "gallon", 3.78541,
            "gallons", 3.78541,
            "gal", 3.78541,
            "ft3", 28.3168,
            "barrel", 158.987,
            "bbl", 158.987
    )),

    WEIGHT("kg", table(
            "kg", 1.0,
            "g", 0.001,
            "tonnes", 1_000.0,
            "tonne", 1_000.0,
            "ton", 1_000.0,
            "t", 1_000.0,
            "lb", 0.453592,
            "lbs", 0.453592,
            "pounds", 0.453592,
            "oz", 0.0283495,
            "stone", 6.35029
    )),

    DISTANCE("km", table(
            "km", 1.0,
            "m", 0.001,
            "cm", 0.00001,
            "mm", 0.000001,
            "miles", 1.60934,
            "mile", 1.60934,
            "mi", 1.60934,
            "ft", 0.0003048,
            "in", 0.0000254,
            "yd", 0.0009144
    ));

    private final String baseUnit;
    private final Map<String, Double> multipliers;

    UnitFamily(String baseUnit, Map<String, Double> multipliers) {
        this.baseUnit = baseUnit;
        this.multipliers = multipliers;
    }

    public String baseUnit() {
        return baseUnit;
    }

    public boolean contains(String normalizedUnit) {
        return multipliers.containsKey(normalizedUnit);
    }

    /** Multiplier to the base unit, or null when the unit is not a member. */
    public Double multiplier(String normalizedUnit) {
        return multipliers.get(normalizedUnit);
    }

    public Map<String, Double> multipliers() {
        return multipliers;
    }

    private static Map<String, Double> table(Object... pairs) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((String) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        return Map.copyOf(m);
    }
}

package org.learningjava.carbonengine.domain.service.backend;

import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.factor.Scope;

import java.util.List;
import java.util.Locale;

/**
 * Fixed illustrative factors for the last-resort backend. Values are kg CO2e per {@code unit}.
 */
public final class DemoFactorTable {

    public record Entry(String category, String unit, double value, Scope scope, List<String> keywords) {}

    public static final Entry FUEL = new Entry("fuel", "L", 2.31, Scope.SCOPE_1,
            List.of("fuel", "diesel", "petrol", "gasoline", "benzine", "lpg", "kerosene"));
    public static final Entry ELECTRICITY = new Entry("electricity", "kWh", 0.40, Scope.SCOPE_2,
            List.of("electricity", "electric", "kwh", "grid", "power", "stroom", "elektriciteit"));
    public static final Entry TRAVEL = new Entry("travel", "km", 0.15, Scope.SCOPE_3,
            List.of("travel", "transport", "flight", "train", "taxi", "car", "vehicle", "km"));
    public static final Entry HEATING = new Entry("heating", "m3", 1.90, Scope.SCOPE_1,
            List.of("heating", "natural gas", "gas", "boiler", "verwarming"));
    public static final Entry WATER = new Entry("water", "m3", 0.34, Scope.SCOPE_3,
            List.of("water"));
    public static final Entry OTHER = new Entry("other", "unit", 0.50, Scope.SCOPE_3, List.of());

    // keyword lookup order; fuel before heating so "gasoline" is not read as gas
    private static final List<Entry> ENTRIES = List.of(ELECTRICITY, FUEL, HEATING, TRAVEL, WATER);

    private DemoFactorTable() {}

    public static List<Entry> entries() {
        return List.of(FUEL, ELECTRICITY, TRAVEL, HEATING, WATER, OTHER);
    }

    /** Category first, then keywords in fuel type, subcategory and description, else {@link #OTHER}. */
    public static Entry lookup(ParsedActivity activity) {
        String category = lower(activity.category());
        for (Entry e : ENTRIES) {
            if (e.category().equals(category)) return e;
        }
        String text = String.join(" ",
                lower(activity.fuelType()), lower(activity.subcategory()), lower(activity.description()));
        for (Entry e : ENTRIES) {
            for (String k : e.keywords()) {
                if (text.contains(k)) return e;
            }
        }
        return OTHER;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}

package org.learningjava.carbonengine.domain.service.scope;

import java.util.Locale;

/** Lower-cased classifier inputs; null becomes "". */
public record ScopeSignals(String activity, String fuel, String unit, String description) {

    public static ScopeSignals of(String activity, String fuel, String unit, String description) {
        return new ScopeSignals(lower(activity), lower(fuel), lower(unit), lower(description));
    }

    public boolean activityHas(String... needles) {
        return containsAny(activity, needles);
    }

    public boolean fuelHas(String... needles) {
        return containsAny(fuel, needles);
    }

    public boolean unitHas(String... needles) {
        return containsAny(unit, needles);
    }

    public boolean descriptionHas(String... needles) {
        return containsAny(description, needles);
    }

    private static boolean containsAny(String haystack, String... needles) {
        for (String n : needles) {
            if (haystack.contains(n)) return true;
        }
        return false;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}

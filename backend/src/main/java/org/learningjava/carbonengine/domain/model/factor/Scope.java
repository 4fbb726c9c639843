package org.learningjava.carbonengine.domain.model.factor;

import java.util.Locale;

public enum Scope {
    SCOPE_1(1),
    SCOPE_2(2),
    SCOPE_3(3);

    private final int number;

    Scope(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public String label() {
        return "Scope " + number;
    }

    /**
     * Accepts "Scope 2", "scope_2", "SCOPE_2" or a bare "2".
     * Returns null for blank or unknown input.
     */
    public static Scope parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String digits = raw.toLowerCase(Locale.ROOT).replaceAll("[^0-9]", "");
        return switch (digits) {
            case "1" -> SCOPE_1;
            case "2" -> SCOPE_2;
            case "3" -> SCOPE_3;
            default -> null;
        };
    }
}

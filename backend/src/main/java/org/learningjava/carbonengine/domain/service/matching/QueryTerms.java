package org.learningjava.carbonengine.domain.service.matching;

import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Builds the semantic representation of an activity for factor lookup. */
public final class QueryTerms {

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "of", "in", "on", "at", "with", "from", "per", "by", "to", "our", "van", "het", "een");

    private QueryTerms() {}

    /** Context terms implied by the unit alone. */
    public static List<String> unitKeyTerms(String unit) {
        String u = unit == null ? "" : unit.trim().toLowerCase(Locale.ROOT);
        return switch (u) {
            case "l", "liter", "liters", "litre", "litres" -> List.of("liquid fuel");
            case "kwh", "mwh" -> List.of("electricity");
            case "m3", "cubic meter" -> List.of("gas");
            case "km", "mile", "miles" -> List.of("transport");
            default -> List.of();
        };
    }

    /** Embedding input: description, key terms, unit. */
    public static String embeddingText(ParsedActivity a) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, a.description());
        addIfPresent(parts, a.fuelType());
        addIfPresent(parts, a.subcategory());
        addIfPresent(parts, a.category());
        parts.addAll(unitKeyTerms(a.unit()));
        addIfPresent(parts, a.unit());
        return String.join(" ", parts);
    }

    /** Lower-case terms for categorical matching, most specific first, no duplicates. */
    public static List<String> matchTerms(ParsedActivity a) {
        Set<String> out = new LinkedHashSet<>();
        addLower(out, a.fuelType());
        addLower(out, a.subcategory());
        addLower(out, a.category());
        for (String t : unitKeyTerms(a.unit())) addLower(out, t);
        if (a.description() != null) {
            for (String tok : tokenize(a.description())) {
                if (tok.length() >= 3 && !STOPWORDS.contains(tok) && !isNumeric(tok)) out.add(tok);
            }
        }
        return List.copyOf(out);
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        String cleaned = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}\\s]", " ").trim();
        if (cleaned.isEmpty()) return List.of();
        return List.of(cleaned.split("\\s+"));
    }

    private static boolean isNumeric(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    private static void addIfPresent(List<String> parts, String s) {
        if (s != null && !s.isBlank()) parts.add(s.trim());
    }

    private static void addLower(Set<String> out, String s) {
        if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
    }
}

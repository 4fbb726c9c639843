package org.learningjava.carbonengine.domain.service.units;

import org.learningjava.carbonengine.domain.exception.ConversionUnsupportedException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Converts quantities within one {@link UnitFamily}. Stateless; the tables are constants.
 */
@Component
public class UnitConverter {

    /** Bump when a unit or multiplier changes; consumers rely on exact semantics. */
    public static final String VOCABULARY_VERSION = "1.0";

    public double convert(double value, String fromUnit, String toUnit) {
        String from = normalize(fromUnit);
        String to = normalize(toUnit);

        if (!from.isEmpty() && from.equals(to)) {
            return value;
        }

        UnitFamily fromFamily = familyOf(from)
                .orElseThrow(() -> new ConversionUnsupportedException(fromUnit, toUnit, "unknown unit '" + fromUnit + "'"));
        UnitFamily toFamily = familyOf(to)
                .orElseThrow(() -> new ConversionUnsupportedException(fromUnit, toUnit, "unknown unit '" + toUnit + "'"));

        if (fromFamily != toFamily) {
            throw new ConversionUnsupportedException(fromUnit, toUnit,
                    fromFamily.name().toLowerCase(Locale.ROOT) + " and " + toFamily.name().toLowerCase(Locale.ROOT)
                            + " are different unit families");
        }
        return value * fromFamily.multiplier(from) / fromFamily.multiplier(to);
    }

    public ConversionResult describe(double value, String fromUnit, String toUnit) {
        double converted = convert(value, fromUnit, toUnit);
        double factor = convert(1.0, fromUnit, toUnit);
        return new ConversionResult(value, fromUnit, converted, toUnit, factor);
    }

    public Optional<UnitFamily> familyOf(String unit) {
        String u = normalize(unit);
        for (UnitFamily f : UnitFamily.values()) {
            if (f.contains(u)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public boolean isSupported(String unit) {
        return familyOf(unit).isPresent();
    }

    static String normalize(String unit) {
        return unit == null ? "" : unit.trim().toLowerCase(Locale.ROOT);
    }
}

package org.learningjava.carbonengine.domain.service.normalize;

import org.learningjava.carbonengine.application.port.ActivityExtractionPort;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.exception.ValidationException;
import org.learningjava.carbonengine.domain.model.activity.ExtractedActivity;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.activity.StructuredActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Turns free text or caller-supplied fields into a validated {@link ParsedActivity}.
 * Free text goes through the {@link ActivityExtractionPort}; the normalizer only validates.
 */
@Service
public class ActivityNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ActivityNormalizer.class);

    static final String DEFAULT_CATEGORY = "other";
    static final double TRUSTED_CONFIDENCE = 1.0;

    private final ActivityExtractionPort extraction;

    public ActivityNormalizer(ActivityExtractionPort extraction) {
        this.extraction = extraction;
    }

    public ParsedActivity normalize(String rawInput) {
        if (rawInput == null || rawInput.isBlank()) {
            throw new ValidationException("raw input is blank");
        }

        ExtractedActivity extracted;
        try {
            extracted = extraction.extract(rawInput);
        } catch (BackendUnavailableException e) {
            log.warn("Activity extraction unavailable for '{}': {}", rawInput, e.getMessage());
            throw new ValidationException("Could not parse activity: " + e.getMessage(), e);
        }
        if (extracted == null) {
            throw new ValidationException("Activity extraction returned nothing for: " + rawInput);
        }

        // extraction without a description still gets something searchable
        String description = isBlank(extracted.description()) ? rawInput.trim() : extracted.description();

        ParsedActivity parsed = validate(
                extracted.category(), extracted.subcategory(), extracted.fuelType(),
                extracted.quantity(), extracted.unit(), description,
                extracted.confidence() == null ? 0.0 : extracted.confidence());

        if (log.isDebugEnabled()) log.debug("Parsed '{}' -> {}", rawInput, parsed);
        return parsed;
    }

    public ParsedActivity normalize(StructuredActivity fields) {
        if (fields == null) {
            throw new ValidationException("structured activity is missing");
        }
        double confidence = fields.confidence() == null ? TRUSTED_CONFIDENCE : fields.confidence();
        String description = isBlank(fields.description())
                ? joinNonBlank(fields.fuelType(), fields.subcategory(), fields.category())
                : fields.description();

        return validate(fields.category(), fields.subcategory(), fields.fuelType(),
                fields.quantity(), fields.unit(), description, confidence);
    }

    private ParsedActivity validate(String category, String subcategory, String fuelType,
                                    Double quantity, String unit, String description, double confidence) {
        if (quantity == null) {
            throw new ValidationException("quantity is missing");
        }
        if (!Double.isFinite(quantity) || quantity <= 0) {
            throw new ValidationException("quantity must be > 0, got " + quantity);
        }
        if (isBlank(unit)) {
            throw new ValidationException("unit is missing");
        }
        if (Double.isNaN(confidence)) {
            throw new ValidationException("confidence is not a number");
        }

        String cat = isBlank(category) ? DEFAULT_CATEGORY : category.trim().toLowerCase(Locale.ROOT);
        return new ParsedActivity(
                cat,
                trimToNull(subcategory),
                trimToNull(fuelType),
                quantity,
                unit.trim(),
                description == null ? "" : description.trim(),
                clamp(confidence)
        );
    }

    static double clamp(double c) {
        return Math.max(0.0, Math.min(1.0, c));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String trimToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }

    private static String joinNonBlank(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (!isBlank(p)) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(p.trim());
            }
        }
        return sb.toString();
    }
}

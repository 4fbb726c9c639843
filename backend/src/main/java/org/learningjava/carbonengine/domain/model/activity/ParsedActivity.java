package org.learningjava.carbonengine.domain.model.activity;

/**
 * Canonical form of an activity after normalization.
 * Instances are only built by the normalizer, which guarantees
 * {@code quantity > 0}, a non-blank unit and a confidence in [0,1].
 */
public record ParsedActivity(
        String category,
        String subcategory,
        String fuelType,
        double quantity,
        String unit,
        String description,
        double confidence
) {}

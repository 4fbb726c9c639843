package org.learningjava.carbonengine.domain.model.activity;

/**
 * Raw fields returned by the language-understanding backend for a piece of free text.
 * Any field may be missing or nonsensical; the normalizer decides.
 */
public record ExtractedActivity(
        String category,
        String subcategory,
        String fuelType,
        Double quantity,
        String unit,
        String description,
        Double confidence
) {}

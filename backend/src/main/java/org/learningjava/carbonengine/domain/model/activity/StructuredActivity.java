package org.learningjava.carbonengine.domain.model.activity;

/**
 * Caller-supplied fields, not yet validated. {@code confidence} is optional;
 * structured input is trusted (1.0) unless the caller says otherwise.
 */
public record StructuredActivity(
        String category,
        String subcategory,
        String fuelType,
        Double quantity,
        String unit,
        String description,
        Double confidence
) {}

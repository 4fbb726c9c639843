package org.learningjava.carbonengine.domain.service.matching;

import org.junit.jupiter.api.Test;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.Scope;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityTest {

    private static EmissionFactorRecord factor(String activity, String fuel, String description) {
        return new EmissionFactorRecord("f1", activity, fuel, "UK", "DEFRA", "kg CO2e/L", 2.0,
                Scope.SCOPE_1, null, description);
    }

    @Test
    void cosine_identicalVectorsIsOne() {
        assertEquals(1.0, Similarity.cosine(new float[]{1f, 2f, 3f}, new float[]{1f, 2f, 3f}), 1e-6);
    }

    @Test
    void cosine_orthogonalIsZero() {
        assertEquals(0.0, Similarity.cosine(new float[]{1f, 0f}, new float[]{0f, 1f}), 1e-12);
    }

    @Test
    void cosine_negativeIsClampedToZero() {
        assertEquals(0.0, Similarity.cosine(new float[]{1f, 0f}, new float[]{-1f, 0f}), 0.0);
    }

    @Test
    void cosine_mismatchedOrEmptyIsZero() {
        assertEquals(0.0, Similarity.cosine(new float[]{1f}, new float[]{1f, 2f}), 0.0);
        assertEquals(0.0, Similarity.cosine(new float[0], new float[0]), 0.0);
        assertEquals(0.0, Similarity.cosine(null, new float[]{1f}), 0.0);
        assertEquals(0.0, Similarity.cosine(new float[]{0f, 0f}, new float[]{1f, 1f}), 0.0);
    }

    @Test
    void termScore_exactFuel() {
        var f = factor("Fuel combustion", "petrol", "Petrol for passenger cars");
        // petrol exact (0.80) + 1 of 2 terms found
        assertEquals(0.80 + 0.20 * 1 / 2, Similarity.termScore(f, List.of("petrol", "xyz")), 1e-12);
    }

    @Test
    void termScore_partialActivity() {
        var f = factor("Fuel combustion", "petrol", "Petrol for passenger cars");
        assertEquals(0.65 + 0.20, Similarity.termScore(f, List.of("combustion")), 1e-12);
    }

    @Test
    void termScore_descriptionOnly() {
        var f = factor("Fuel combustion", "petrol", "Petrol for passenger cars");
        assertEquals(0.50 + 0.20, Similarity.termScore(f, List.of("passenger")), 1e-12);
    }

    @Test
    void termScore_isCappedAtOne() {
        var f = factor("petrol", "petrol", "petrol");
        assertEquals(1.0, Similarity.termScore(f, List.of("petrol")), 0.0);
    }

    @Test
    void termScore_noHitOrNoTermsIsZero() {
        var f = factor("Fuel combustion", "petrol", null);
        assertEquals(0.0, Similarity.termScore(f, List.of("electricity")), 0.0);
        assertEquals(0.0, Similarity.termScore(f, List.of()), 0.0);
    }
}

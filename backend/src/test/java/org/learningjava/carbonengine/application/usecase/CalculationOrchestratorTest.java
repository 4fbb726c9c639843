package org.learningjava.carbonengine.application.usecase;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.carbonengine.application.port.AssistantPort;
import org.learningjava.carbonengine.application.port.AssistantPort.AssistantEstimate;
import org.learningjava.carbonengine.application.port.EmbeddingPort;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.exception.CalculationCancelledException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendEstimate;
import org.learningjava.carbonengine.domain.model.calculation.BackendOutcome;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.calculation.RejectionReason;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.learningjava.carbonengine.domain.service.backend.AssistantBackend;
import org.learningjava.carbonengine.domain.service.backend.CalculationBackend;
import org.learningjava.carbonengine.domain.service.backend.DemoBackend;
import org.learningjava.carbonengine.domain.service.backend.VectorMatchBackend;
import org.learningjava.carbonengine.domain.service.matching.EmissionFactorMatcher;
import org.learningjava.carbonengine.domain.service.scope.ScopeClassifier;
import org.learningjava.carbonengine.domain.service.units.UnitConverter;
import org.learningjava.carbonengine.infrastructure.adapter.out.memory.InMemoryFactorStoreAdapter;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CalculationOrchestratorTest {

    private static final EmissionFactorRecord PETROL = new EmissionFactorRecord(
            "defra-2023-petrol", "Fuel combustion", "petrol", "UK", "DEFRA 2023", "kg CO2e/L", 2.19,
            Scope.SCOPE_1, null, "Petrol vehicle fuel combustion");
    private static final EmissionFactorRecord GRID = new EmissionFactorRecord(
            "defra-2023-electricity-uk", "Purchased electricity", "electricity", "UK", "DEFRA 2023",
            "kg CO2e/kWh", 0.207, Scope.SCOPE_2, null, "UK grid electricity consumption");

    private static final float[] PETROL_VEC = {1f, 0f, 0f};
    private static final float[] GRID_VEC = {0f, 1f, 0f};

    private EmbeddingPort embedding;
    private AssistantPort assistant;
    private ExecutorService executor;
    private EngineProperties props;
    private CalculationOrchestrator orchestrator;

    private final ParsedActivity petrol =
            new ParsedActivity("fuel", null, "petrol", 50, "liters", "50 liters of petrol", 1.0);

    @BeforeEach
    void setUp() {
        embedding = mock(EmbeddingPort.class);
        assistant = mock(AssistantPort.class);
        executor = Executors.newSingleThreadExecutor();
        props = new EngineProperties();
        props.getAssistant().setRetries(0);

        InMemoryFactorStoreAdapter store = new InMemoryFactorStoreAdapter();
        store.upsertFactors(List.of(PETROL, GRID), List.of(PETROL_VEC, GRID_VEC));

        UnitConverter converter = new UnitConverter();
        EmissionFactorMatcher matcher = new EmissionFactorMatcher(embedding, store, props);

        // deliberately out of order; the orchestrator sorts by backend type
        orchestrator = new CalculationOrchestrator(List.of(
                new DemoBackend(converter),
                new AssistantBackend(assistant, executor, converter, props),
                new VectorMatchBackend(matcher, converter, props)
        ), new ScopeClassifier());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void closeVectorMatch_isUsedDirectly() {
        when(embedding.embed(anyString())).thenReturn(new float[]{1f, 0f, 0f});

        CalculationResult r = orchestrator.calculate(petrol, null);

        assertEquals(BackendType.VECTOR_MATCH, r.backendUsed());
        assertEquals(109.5, r.totalEmissions(), 1e-9);
        assertEquals(CalculationResult.KG_CO2E, r.emissionsUnit());
        assertEquals(Scope.SCOPE_1, r.scope());
        assertEquals(1.0, r.confidence(), 1e-9);
        assertEquals("defra-2023-petrol", r.matchedFactor().id());
        assertTrue(r.fallbackReasons().isEmpty());
        assertTrue(r.processingTimeMs() >= 0);
        verifyNoInteractions(assistant);
    }

    @Test
    void weakMatch_fallsBackToAssistant() {
        // cosine with PETROL_VEC is 0.5
        when(embedding.embed(anyString())).thenReturn(new float[]{0.5f, 0f, (float) Math.sqrt(0.75)});
        when(assistant.structuredCalculate(anyString(), anyList()))
                .thenReturn(new AssistantEstimate(2.3, "kg CO2e/L", null, "Scope 1", "IPCC", 0.9, null));

        CalculationResult r = orchestrator.calculate(petrol, null);

        assertEquals(BackendType.ASSISTANT, r.backendUsed());
        assertEquals(115.0, r.totalEmissions(), 1e-9);
        assertEquals(1, r.fallbackReasons().size());
        assertTrue(r.fallbackReasons().get(0).startsWith("VECTOR_MATCH: NO_MATCH_FOUND"));
    }

    @Test
    void weakMatchAndAssistantDown_endsInDemo() {
        when(embedding.embed(anyString())).thenReturn(new float[]{0.5f, 0f, (float) Math.sqrt(0.75)});
        when(assistant.structuredCalculate(anyString(), anyList())).thenThrow(new BackendUnavailableException("down"));

        CalculationResult r = orchestrator.calculate(petrol, null);

        assertEquals(BackendType.DEMO, r.backendUsed());
        assertEquals(50 * 2.31, r.totalEmissions(), 1e-9);
        assertEquals(0.3, r.confidence(), 1e-9);
        assertEquals(2, r.fallbackReasons().size());
        assertTrue(r.fallbackReasons().get(1).startsWith("ASSISTANT: BACKEND_UNAVAILABLE"));
    }

    @Test
    void embeddingOutage_stillMatchesOnTerms() {
        when(embedding.embed(anyString())).thenThrow(new BackendUnavailableException("ollama down"));

        CalculationResult r = orchestrator.calculate(petrol, null);

        assertEquals(BackendType.VECTOR_MATCH, r.backendUsed());
        assertEquals("defra-2023-petrol", r.matchedFactor().id());
        assertEquals(109.5, r.totalEmissions(), 1e-9);
    }

    @Test
    void missingScope_isClassifiedFromFactor() {
        CalculationBackend vector = stub(BackendType.VECTOR_MATCH, BackendOutcome.accepted(BackendType.VECTOR_MATCH,
                new BackendEstimate(10, CalculationResult.KG_CO2E, null, null, 0.8,
                        new EmissionFactorRecord("x", "Purchased electricity", "electricity", null, "X",
                                "kg CO2e/kWh", 0.2, null, null, null),
                        List.of(), 50)));
        CalculationOrchestrator o = new CalculationOrchestrator(
                List.of(vector, stub(BackendType.DEMO, null)), new ScopeClassifier());

        CalculationResult r = o.calculate(
                new ParsedActivity("electricity", null, null, 50, "kWh", "office", 1.0), null);

        assertEquals(Scope.SCOPE_2, r.scope());
    }

    @Test
    void unexpectedBackendException_isTreatedAsRejection() {
        CalculationBackend vector = mock(CalculationBackend.class);
        when(vector.type()).thenReturn(BackendType.VECTOR_MATCH);
        when(vector.attempt(any(), any())).thenThrow(new IllegalStateException("bug"));
        CalculationOrchestrator o = new CalculationOrchestrator(
                List.of(vector, new DemoBackend(new UnitConverter())), new ScopeClassifier());

        CalculationResult r = o.calculate(petrol, null);

        assertEquals(BackendType.DEMO, r.backendUsed());
        assertEquals(List.of("VECTOR_MATCH: BACKEND_UNAVAILABLE (bug)"), r.fallbackReasons());
    }

    @Test
    void confidenceIsClampedToOne() {
        CalculationBackend demo = stub(BackendType.DEMO, BackendOutcome.accepted(BackendType.DEMO,
                new BackendEstimate(1, CalculationResult.KG_CO2E, null, Scope.SCOPE_3, 1.4, null, null, 1)));
        CalculationOrchestrator o = new CalculationOrchestrator(List.of(demo), new ScopeClassifier());

        CalculationResult r = o.calculate(petrol, null);

        assertEquals(1.0, r.confidence(), 0.0);
        assertTrue(r.alternatives().isEmpty());
    }

    @Test
    void interruptedThread_cancelsBeforeAnyBackend() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(CalculationCancelledException.class, () -> orchestrator.calculate(petrol, null));
            verifyNoInteractions(embedding);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void chainWithoutDemo_isRejected() {
        assertThrows(IllegalStateException.class, () -> new CalculationOrchestrator(
                List.of(stub(BackendType.VECTOR_MATCH, null)), new ScopeClassifier()));
    }

    @Test
    void duplicateBackendTypes_areRejected() {
        assertThrows(IllegalStateException.class, () -> new CalculationOrchestrator(
                List.of(stub(BackendType.DEMO, null), stub(BackendType.DEMO, null)), new ScopeClassifier()));
    }

    private static CalculationBackend stub(BackendType type, BackendOutcome outcome) {
        CalculationBackend b = mock(CalculationBackend.class);
        when(b.type()).thenReturn(type);
        when(b.attempt(any(), any())).thenReturn(
                outcome != null ? outcome : BackendOutcome.rejected(type, RejectionReason.DISABLED, null));
        return b;
    }
}

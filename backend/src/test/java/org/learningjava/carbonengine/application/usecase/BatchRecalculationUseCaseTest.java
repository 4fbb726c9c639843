package org.learningjava.carbonengine.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.CalculationCancelledException;
import org.learningjava.carbonengine.domain.exception.ValidationException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.BatchSummary;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRequest;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResponse;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.factor.Scope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BatchRecalculationUseCaseTest {

    private CalculateEmissionsUseCase calculate;
    private EngineProperties props;
    private List<Duration> pauses;
    private BatchRecalculationUseCase batch;

    @BeforeEach
    void setUp() {
        calculate = mock(CalculateEmissionsUseCase.class);
        props = new EngineProperties();
        props.getBatch().setChunkSize(2);
        props.getBatch().setPause(Duration.ofMillis(250));
        pauses = new ArrayList<>();
        batch = new BatchRecalculationUseCase(calculate, props, pauses::add);
    }

    private static CalculationResponse ok(BackendType backend, long ms) {
        ParsedActivity a = new ParsedActivity("fuel", null, "diesel", 1, "L", "diesel", 1.0);
        return CalculationResponse.ok(new CalculationResult(2.5, CalculationResult.KG_CO2E, null, Scope.SCOPE_1,
                0.9, null, List.of(), backend, ms, a, 1, List.of()), 1L);
    }

    private static List<CalculationRequest> requests(int n) {
        List<CalculationRequest> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(CalculationRequest.ofText("item " + i, false));
        return out;
    }

    @Test
    void countsPerBackend_andKeepsGoingAfterFailure() {
        List<CalculationRequest> items = requests(5);
        when(calculate.handle(items.get(0))).thenReturn(ok(BackendType.VECTOR_MATCH, 10));
        when(calculate.handle(items.get(1))).thenThrow(new ValidationException("quantity is missing"));
        when(calculate.handle(items.get(2))).thenReturn(ok(BackendType.ASSISTANT, 20));
        when(calculate.handle(items.get(3))).thenReturn(ok(BackendType.DEMO, 5));
        when(calculate.handle(items.get(4))).thenReturn(ok(BackendType.VECTOR_MATCH, 15));

        BatchSummary s = batch.run(items);

        assertEquals(5, s.totalEntries());
        assertEquals(2, s.vectorMatched());
        assertEquals(1, s.assistant());
        assertEquals(1, s.demo());
        assertEquals(1, s.failed());
        assertEquals(50, s.totalProcessingTimeMs());
        assertEquals(List.of(new BatchSummary.ItemError(1, "quantity is missing")), s.errors());
        assertEquals(5, s.results().size());
        assertFalse(s.results().get(1).success());
    }

    @Test
    void pausesBetweenChunksOnly() {
        when(calculate.handle(any())).thenReturn(ok(BackendType.DEMO, 1));

        batch.run(requests(5));

        // chunks [0,1] [2,3] [4]
        assertEquals(List.of(Duration.ofMillis(250), Duration.ofMillis(250)), pauses);
    }

    @Test
    void zeroPause_neverSleeps() {
        props.getBatch().setPause(Duration.ZERO);
        when(calculate.handle(any())).thenReturn(ok(BackendType.DEMO, 1));

        batch.run(requests(4));

        assertTrue(pauses.isEmpty());
    }

    @Test
    void progressIsReportedPerChunk() {
        when(calculate.handle(any())).thenReturn(ok(BackendType.DEMO, 1));
        List<String> messages = new ArrayList<>();

        batch.run(requests(3), (processed, message) -> messages.add(processed + ":" + message));

        assertEquals(List.of("2:Processed 2/3", "3:Processed 3/3"), messages);
    }

    @Test
    void interruptedPause_cancelsBatch() {
        when(calculate.handle(any())).thenReturn(ok(BackendType.DEMO, 1));
        BatchRecalculationUseCase interrupted = new BatchRecalculationUseCase(calculate, props, d -> {
            throw new InterruptedException("stop");
        });

        try {
            assertThrows(CalculationCancelledException.class, () -> interrupted.run(requests(3)));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        verify(calculate, times(2)).handle(any());
    }

    @Test
    void cancellationInsideItem_stopsBatch() {
        when(calculate.handle(any())).thenThrow(new CalculationCancelledException("cancelled", null));

        assertThrows(CalculationCancelledException.class, () -> batch.run(requests(3)));
        verify(calculate, times(1)).handle(any());
    }

    @Test
    void emptyBatch_returnsEmptySummary() {
        BatchSummary s = batch.run(null);

        assertEquals(0, s.totalEntries());
        assertTrue(s.results().isEmpty());
        verifyNoInteractions(calculate);
    }
}

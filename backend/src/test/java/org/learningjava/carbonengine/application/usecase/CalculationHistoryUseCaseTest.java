package org.learningjava.carbonengine.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.carbonengine.application.port.CalculationStorePort;
import org.learningjava.carbonengine.domain.exception.ValidationException;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRecord;
import org.learningjava.carbonengine.domain.model.calculation.CalculationSummary;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CalculationHistoryUseCaseTest {

    private CalculationStorePort store;
    private CalculationHistoryUseCase history;

    @BeforeEach
    void setUp() {
        store = mock(CalculationStorePort.class);
        history = new CalculationHistoryUseCase(store);
    }

    private static CalculationRecord row(long id, BackendType backend, double confidence, OffsetDateTime at) {
        return new CalculationRecord(id, "acme", "diesel", "fuel", 10, "L", "defra-2023-diesel", 2.51, 25.1,
                "kg CO2e", 1, confidence, backend, 15, at);
    }

    @Test
    void history_defaultsAndCapsLimit() {
        when(store.listByCompany(any(), anyInt())).thenReturn(List.of());

        history.history("acme", null);
        history.history("acme", 10_000);

        verify(store).listByCompany("acme", 50);
        verify(store).listByCompany("acme", 500);
    }

    @Test
    void history_nonPositiveLimitIsRejected() {
        assertThrows(ValidationException.class, () -> history.history("acme", 0));
        verifyNoInteractions(store);
    }

    @Test
    void summary_isAggregatedByTheStore() {
        CalculationSummary aggregate = new CalculationSummary(12_345,
                Map.of(BackendType.VECTOR_MATCH, 12_000, BackendType.ASSISTANT, 300, BackendType.DEMO, 45),
                0.81, OffsetDateTime.of(2025, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC));
        when(store.summarize("acme")).thenReturn(aggregate);

        assertSame(aggregate, history.summary("acme"));
        verify(store, never()).listByCompany(any(), anyInt());
    }

    @Test
    void get_delegatesToStore() {
        CalculationRecord r = row(9, BackendType.ASSISTANT, 0.8, null);
        when(store.findById(9L)).thenReturn(Optional.of(r));

        assertSame(r, history.get(9L).orElseThrow());
        assertTrue(history.get(10L).isEmpty());
    }
}

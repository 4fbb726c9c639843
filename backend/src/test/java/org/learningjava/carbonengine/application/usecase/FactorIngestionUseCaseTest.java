package org.learningjava.carbonengine.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.carbonengine.application.port.EmbeddingPort;
import org.learningjava.carbonengine.application.port.FactorSeedReaderPort;
import org.learningjava.carbonengine.application.port.FactorStorePort;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FactorIngestionUseCaseTest {

    private FactorSeedReaderPort reader;
    private FactorStorePort store;
    private EmbeddingPort embedding;
    private EngineProperties props;
    private FactorIngestionUseCase ingestion;

    private static final EmissionFactorRecord DIESEL = new EmissionFactorRecord("d", "Fuel combustion", "diesel",
            "UK", "DEFRA", "kg CO2e/L", 2.51, Scope.SCOPE_1, null, "Diesel");
    private static final EmissionFactorRecord GRID = new EmissionFactorRecord("g", "Purchased electricity",
            "electricity", "UK", "DEFRA", "kg CO2e/kWh", 0.207, Scope.SCOPE_2, null, "Grid");

    @BeforeEach
    void setUp() {
        reader = mock(FactorSeedReaderPort.class);
        store = mock(FactorStorePort.class);
        embedding = mock(EmbeddingPort.class);
        props = new EngineProperties();
        ingestion = new FactorIngestionUseCase(reader, store, embedding, props);
    }

    @Test
    void ingest_embedsSearchTextAndUpserts() {
        // given
        when(reader.read("classpath:emission-factors.json")).thenReturn(List.of(DIESEL, GRID));
        List<float[]> vectors = List.of(new float[]{1f}, new float[]{2f});
        when(embedding.embedBatch(anyList())).thenReturn(vectors);

        // when
        int n = ingestion.ingestDefault();

        // then
        assertThat(n).isEqualTo(2);
        InOrder order = inOrder(store);
        order.verify(store).ensureSchema();
        order.verify(store).upsertFactors(List.of(DIESEL, GRID), vectors);
        verify(embedding).embedBatch(List.of(DIESEL.searchText(), GRID.searchText()));
    }

    @Test
    void embeddingOutage_storesFactorsWithoutVectors() {
        when(reader.read(anyString())).thenReturn(List.of(DIESEL, GRID));
        when(embedding.embedBatch(anyList())).thenThrow(new BackendUnavailableException("down"));

        assertThat(ingestion.ingest("file:/tmp/factors.json")).isEqualTo(2);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<float[]>> cap = ArgumentCaptor.forClass(List.class);
        verify(store).upsertFactors(eq(List.of(DIESEL, GRID)), cap.capture());
        assertThat(cap.getValue()).hasSize(2);
        assertThat(cap.getValue().get(0)).isEmpty();
    }

    @Test
    void wrongVectorCount_storesFactorsWithoutVectors() {
        when(reader.read(anyString())).thenReturn(List.of(DIESEL, GRID));
        when(embedding.embedBatch(anyList())).thenReturn(List.of(new float[]{1f}));

        ingestion.ingest("x");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<float[]>> cap = ArgumentCaptor.forClass(List.class);
        verify(store).upsertFactors(anyList(), cap.capture());
        assertThat(cap.getValue()).hasSize(2);
    }

    @Test
    void emptySeed_touchesNothing() {
        when(reader.read(anyString())).thenReturn(List.of());

        assertThat(ingestion.ingest("x")).isZero();
        verifyNoInteractions(store, embedding);
    }
}

package org.learningjava.carbonengine.infrastructure.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.carbonengine.application.usecase.CalculateEmissionsUseCase;
import org.learningjava.carbonengine.application.usecase.CalculationHistoryUseCase;
import org.learningjava.carbonengine.domain.exception.CalculationCancelledException;
import org.learningjava.carbonengine.domain.exception.ValidationException;
import org.learningjava.carbonengine.domain.model.activity.ParsedActivity;
import org.learningjava.carbonengine.domain.model.calculation.BackendType;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRecord;
import org.learningjava.carbonengine.domain.model.calculation.CalculationRequest;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResponse;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResult;
import org.learningjava.carbonengine.domain.model.calculation.CalculationSummary;
import org.learningjava.carbonengine.domain.model.factor.EmissionFactorRecord;
import org.learningjava.carbonengine.domain.model.factor.Scope;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class CalculationControllerTest {

    private CalculateEmissionsUseCase calculate;
    private CalculationHistoryUseCase history;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        calculate = Mockito.mock(CalculateEmissionsUseCase.class);
        history = Mockito.mock(CalculationHistoryUseCase.class);

        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mvc = MockMvcBuilders
                .standaloneSetup(new CalculationController(calculate, history))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(om))
                .build();
    }

    private static CalculationResult petrolResult() {
        ParsedActivity a = new ParsedActivity("fuel", null, "petrol", 50, "liters", "50 liters of petrol", 1.0);
        EmissionFactorRecord f = new EmissionFactorRecord("defra-2023-petrol", "Fuel combustion", "petrol", "UK",
                "DEFRA 2023", "kg CO2e/L", 2.19, Scope.SCOPE_1, null, "Petrol");
        return new CalculationResult(109.5, CalculationResult.KG_CO2E, null, Scope.SCOPE_1, 0.9, f, List.of(),
                BackendType.VECTOR_MATCH, 35, a, 50, List.of());
    }

    @Test
    void post_returnsCalculation() throws Exception {
        when(calculate.handle(any())).thenReturn(CalculationResponse.ok(petrolResult(), 12L));

        mvc.perform(post("/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawInput\": \"50 liters of petrol\", \"companyId\": \"acme\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.calculationId", is(12)))
                .andExpect(jsonPath("$.calculation.totalEmissions", is(closeTo(109.5, 1e-9))))
                .andExpect(jsonPath("$.calculation.emissionsUnit", is("kg CO2e")))
                .andExpect(jsonPath("$.calculation.scope", is("SCOPE_1")))
                .andExpect(jsonPath("$.calculation.backendUsed", is("VECTOR_MATCH")))
                .andExpect(jsonPath("$.calculation.matchedFactor.id", is("defra-2023-petrol")))
                .andExpect(jsonPath("$.error", is(nullValue())));

        ArgumentCaptor<CalculationRequest> cap = ArgumentCaptor.forClass(CalculationRequest.class);
        verify(calculate).handle(cap.capture());
        assertEquals("50 liters of petrol", cap.getValue().rawInput());
        assertEquals("acme", cap.getValue().companyId());
        assertFalse(cap.getValue().demoMode());
    }

    @Test
    void post_structuredFieldsAreBound() throws Exception {
        when(calculate.handle(any())).thenReturn(CalculationResponse.ok(petrolResult(), null));

        mvc.perform(post("/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"structured": {"category": "electricity", "quantity": 500, "unit": "kWh"},
                                 "demoMode": true, "preferredSource": "DEFRA"}"""))
                .andExpect(status().isOk());

        ArgumentCaptor<CalculationRequest> cap = ArgumentCaptor.forClass(CalculationRequest.class);
        verify(calculate).handle(cap.capture());
        assertEquals(500.0, cap.getValue().structured().quantity(), 0.0);
        assertTrue(cap.getValue().demoMode());
        assertEquals("DEFRA", cap.getValue().preferredSource());
    }

    @Test
    void post_validationErrorIs400WithFailureBody() throws Exception {
        when(calculate.handle(any())).thenThrow(new ValidationException("quantity is missing"));

        mvc.perform(post("/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawInput\": \"some petrol\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.calculation", is(nullValue())))
                .andExpect(jsonPath("$.error", is("quantity is missing")));
    }

    @Test
    void post_malformedJsonIs400() throws Exception {
        mvc.perform(post("/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)));
        verifyNoInteractions(calculate);
    }

    @Test
    void post_cancelledIs503() throws Exception {
        when(calculate.handle(any())).thenThrow(new CalculationCancelledException("shutting down", null));

        mvc.perform(post("/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawInput\": \"10 L diesel\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error", is("shutting down")));
    }

    @Test
    void post_unexpectedErrorIs500() throws Exception {
        when(calculate.handle(any())).thenThrow(new IllegalStateException("boom"));

        mvc.perform(post("/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawInput\": \"10 L diesel\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success", is(false)));
    }

    @Test
    void list_passesCompanyAndLimit() throws Exception {
        OffsetDateTime at = OffsetDateTime.of(2025, 5, 1, 8, 30, 0, 0, ZoneOffset.UTC);
        when(history.history("acme", 2)).thenReturn(List.of(
                new CalculationRecord(5L, "acme", "diesel", "fuel", 10, "L", "defra-2023-diesel", 2.51, 25.1,
                        "kg CO2e", 1, 0.9, BackendType.VECTOR_MATCH, 20, at)));

        mvc.perform(get("/calculations").param("companyId", "acme").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id", is(5)))
                .andExpect(jsonPath("$[0].scope", is(1)))
                .andExpect(jsonPath("$[0].createdAt", is("2025-05-01T08:30:00Z")));
    }

    @Test
    void list_badLimitIs400() throws Exception {
        mvc.perform(get("/calculations").param("limit", "many"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(history);
    }

    @Test
    void summary_isReturned() throws Exception {
        when(history.summary(null)).thenReturn(new CalculationSummary(3,
                Map.of(BackendType.VECTOR_MATCH, 2, BackendType.ASSISTANT, 0, BackendType.DEMO, 1), 0.6, null));

        mvc.perform(get("/calculations/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCalculations", is(3)))
                .andExpect(jsonPath("$.perBackend.VECTOR_MATCH", is(2)))
                .andExpect(jsonPath("$.averageConfidence", is(closeTo(0.6, 1e-9))));
    }

    @Test
    void get_unknownIdIs404() throws Exception {
        when(history.get(77L)).thenReturn(Optional.empty());

        mvc.perform(get("/calculations/77"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.error", containsString("77")));
    }
}

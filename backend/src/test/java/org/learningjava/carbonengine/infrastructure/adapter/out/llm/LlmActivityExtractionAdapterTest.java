package org.learningjava.carbonengine.infrastructure.adapter.out.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.carbonengine.application.port.ChatLLMPort;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.model.activity.ExtractedActivity;
import org.learningjava.carbonengine.domain.service.ChatRegistry;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmActivityExtractionAdapterTest {

    private ChatLLMPort chat;
    private EngineProperties props;
    private LlmActivityExtractionAdapter adapter;

    @BeforeEach
    void setUp() {
        chat = mock(ChatLLMPort.class);
        when(chat.provider()).thenReturn("openrouter");
        props = new EngineProperties();
        adapter = new LlmActivityExtractionAdapter(new ChatRegistry(List.of(chat)), props);
    }

    @Test
    void extract_sendsPromptToConfiguredProvider() {
        when(chat.chat(anyString(), anyString(), anyString())).thenReturn("""
                {"category": "fuel", "fuel_type": "petrol", "quantity": 50, "unit": "liters",
                 "description": "petrol for company car", "confidence": 0.92}""");

        ExtractedActivity a = adapter.extract("We used 50 liters of \"petrol\"");

        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(chat).chat(eq(LlmActivityExtractionAdapter.SYSTEM_PROMPT), user.capture(), eq("openai/gpt-4o-mini"));
        assertTrue(user.getValue().contains("Activity: \"We used 50 liters of 'petrol'\""));
        assertEquals("petrol", a.fuelType());
        assertEquals(50.0, a.quantity(), 0.0);
        assertEquals(0.92, a.confidence(), 0.0);
    }

    @Test
    void parse_handlesFencesProseAndQuotedNumbers() {
        ExtractedActivity a = adapter.parse("""
                Here you go:
                ```json
                {"category": "electricity", "subcategory": "grid", "fuelType": "electricity",
                 "quantity": "1200,5", "unit": "kWh", "confidence": "0.8"}
                ```""");

        assertEquals("electricity", a.category());
        assertEquals("grid", a.subcategory());
        assertEquals("electricity", a.fuelType());
        assertEquals(1200.5, a.quantity(), 1e-9);
        assertEquals(0.8, a.confidence(), 0.0);
        assertNull(a.description());
    }

    @Test
    void parse_blankAndUnparseableFieldsBecomeNull() {
        ExtractedActivity a = adapter.parse("{\"category\": \" \", \"quantity\": \"lots\", \"unit\": null}");

        assertNull(a.category());
        assertNull(a.quantity());
        assertNull(a.unit());
    }

    @Test
    void parse_nonJsonIsBackendUnavailable() {
        assertThrows(BackendUnavailableException.class, () -> adapter.parse("I cannot help with that."));
        assertThrows(BackendUnavailableException.class, () -> adapter.parse(""));
    }

    @Test
    void unknownProvider_isBackendUnavailable() {
        props.getLlm().setProvider("ollama");

        assertThrows(BackendUnavailableException.class, () -> adapter.extract("10 L diesel"));
        verify(chat, never()).chat(anyString(), anyString(), anyString());
    }
}

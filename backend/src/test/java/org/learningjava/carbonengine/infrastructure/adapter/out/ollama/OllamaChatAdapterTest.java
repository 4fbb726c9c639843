package org.learningjava.carbonengine.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.learningjava.carbonengine.application.port.ChatLLMPort.ChatResult;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;

import static org.junit.jupiter.api.Assertions.*;

class OllamaChatAdapterTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void parseReply_messageContentWithCounts() throws Exception {
        ChatResult r = OllamaChatAdapter.parseReply(om.readTree("""
                {"message": {"role": "assistant", "content": "{\\"unit\\": \\"kWh\\"}"},
                 "prompt_eval_count": 64, "eval_count": 12, "done": true}"""));

        assertEquals("{\"unit\": \"kWh\"}", r.text());
        assertEquals(64, r.usage().promptTokens().intValue());
        assertEquals(12, r.usage().completionTokens().intValue());
    }

    @Test
    void parseReply_legacyResponseFieldWithoutUsage() throws Exception {
        ChatResult r = OllamaChatAdapter.parseReply(om.readTree("{\"response\": \"ok\"}"));

        assertEquals("ok", r.text());
        assertNull(r.usage());
    }

    @Test
    void unreachableServer_isBackendUnavailable() {
        OllamaChatAdapter adapter = new OllamaChatAdapter("http://127.0.0.1:1/");

        assertEquals("ollama", adapter.provider());
        assertThrows(BackendUnavailableException.class, () -> adapter.chat("system", "10 L diesel", "llama3.1"));
    }
}

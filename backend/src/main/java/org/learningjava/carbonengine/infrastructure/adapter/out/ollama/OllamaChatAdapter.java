package org.learningjava.carbonengine.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.carbonengine.application.port.ChatLLMPort;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@Component
public class OllamaChatAdapter implements ChatLLMPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaChatAdapter.class);

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;

    private static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .writeTimeout(Duration.ofSeconds(60))
                .readTimeout(Duration.ofMinutes(2))
                .retryOnConnectionFailure(true)
                .build();
    }

    public OllamaChatAdapter(@Value("${carbonengine.ollama.url}") String baseUrl) {
        this.http = defaultClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String provider() { return "ollama"; }

    @Override
    public String chat(String systemPrompt, String userPrompt, String model) {
        return chatWithUsage(systemPrompt, userPrompt, model).text();
    }

    /** Single-turn /api/chat; usage comes from prompt_eval_count and eval_count. */
    @Override
    public ChatResult chatWithUsage(String systemPrompt, String userPrompt, String model) {
        try {
            return doChat(model, systemPrompt, userPrompt);
        } catch (IOException e) {
            throw new BackendUnavailableException("Ollama chat failed: " + e.getMessage(), e);
        }
    }

    private ChatResult doChat(String modelName, String systemPrompt, String userPrompt) throws IOException {
        var body = Map.of(
                "model", modelName,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)),
                "stream", false,
                "format", "json",
                "options", Map.of("temperature", 0)
        );

        var req = new Request.Builder()
                .url(baseUrl + "/api/chat")
                .header("Accept", "application/json")
                .post(RequestBody.create(om.writeValueAsBytes(body), MediaType.parse("application/json")))
                .build();

        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                String bodyStr = resp.body() != null ? resp.body().string() : "";
                throw new IOException("HTTP " + resp.code() + " - " + resp.message() + " | body=" + bodyStr);
            }
            var raw = resp.body() != null ? resp.body().string() : "{}";
            if (log.isDebugEnabled()) log.debug("Ollama chat raw response: {}", raw);
            return parseReply(om.readTree(raw));
        }
    }

    // /api/chat answers in message.content; older builds answer in "response"
    static ChatResult parseReply(JsonNode json) {
        String text = json.path("message").path("content").asText(null);
        if (text == null) text = json.path("response").asText("");
        Integer promptTokens = intOrNull(json.get("prompt_eval_count"));
        Integer completionTokens = intOrNull(json.get("eval_count"));
        Usage usage = (promptTokens != null || completionTokens != null) ? new Usage(promptTokens, completionTokens) : null;
        return new ChatResult(text, usage);
    }

    private static Integer intOrNull(JsonNode n) {
        return n != null && n.canConvertToInt() ? n.asInt() : null;
    }
}

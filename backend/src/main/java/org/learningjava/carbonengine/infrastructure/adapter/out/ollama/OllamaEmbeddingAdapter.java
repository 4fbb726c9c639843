package org.learningjava.carbonengine.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.carbonengine.application.port.EmbeddingPort;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class OllamaEmbeddingAdapter implements EmbeddingPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final String model;

    public OllamaEmbeddingAdapter(String baseUrl, String model) {
        this(baseUrl, model, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(30))
                .build());
    }

    OllamaEmbeddingAdapter(String baseUrl, String model, OkHttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.http = http;
    }

    private static String preview(String text) {
        return text.replace("\n", " ").substring(0, Math.min(40, text.length()));
    }

    @Override public float[] embed(String text) { return embedOne(text); }

    @Override public List<float[]> embedBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(embedOne(t));
        return out;
    }

    @Override public String model() { return model; }

    private float[] embedOne(String text) {
        long t0 = System.nanoTime();
        try {
            ObjectNode body = om.createObjectNode();
            body.put("model", model);
            body.put("prompt", text); // Ollama expects "prompt"

            Request req = new Request.Builder()
                    .url(baseUrl + "/api/embeddings")
                    .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                    .build();

            try (Response resp = http.newCall(req).execute()) {
                if (!resp.isSuccessful()) {
                    log.warn("Ollama embed failed: HTTP {} {}", resp.code(), resp.message());
                    throw new IOException("Ollama embed failed: HTTP " + resp.code());
                }
                String s = resp.body() != null ? resp.body().string() : "{}";
                if (log.isDebugEnabled()) log.debug("Ollama raw embedding response: {}", s);

                float[] v = parseVector(om.readTree(s));
                long latencyMs = Math.max(1L, Math.round((System.nanoTime() - t0) / 1_000_000.0));
                log.debug("Embedding dim={} in {} ms for text preview='{}...'", v.length, latencyMs, preview(text));
                return v;
            }
        } catch (IOException e) {
            log.error("Embedding failed for model '{}' at {}: {}", model, baseUrl, e.getMessage());
            throw new BackendUnavailableException("Embedding failed for model '" + model + "' at " + baseUrl +
                    ". Check model is pulled and API reachable.", e);
        }
    }

    static float[] parseVector(JsonNode json) throws IOException {
        if (json.has("embedding")) {
            return toFloatArray(json.get("embedding"));
        }
        if (json.has("embeddings") && json.get("embeddings").isArray() && json.get("embeddings").size() > 0) {
            JsonNode first = json.get("embeddings").get(0);
            if (first.isArray()) return toFloatArray(first);
            if (first.has("embedding")) return toFloatArray(first.get("embedding"));
        }
        throw new IOException("Unexpected embeddings payload from Ollama");
    }

    private static float[] toFloatArray(JsonNode arr) throws IOException {
        if (arr == null || !arr.isArray()) throw new IOException("Expected numeric array, got: " + arr);
        float[] v = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) v[i] = (float) arr.get(i).asDouble();
        return v;
    }
}

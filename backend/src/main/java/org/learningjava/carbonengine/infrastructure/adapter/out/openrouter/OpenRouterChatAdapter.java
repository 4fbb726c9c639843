package org.learningjava.carbonengine.infrastructure.adapter.out.openrouter;

import org.learningjava.carbonengine.application.port.ChatLLMPort;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Component
public class OpenRouterChatAdapter implements ChatLLMPort {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterChatAdapter.class);

    private final RestTemplate rest;
    private final String apiKey;
    private final String baseUrl;
    private final String referer;
    private final String title;

    @Autowired
    public OpenRouterChatAdapter(
            @Value("${OPENROUTER_API_KEY:}") String envKey,
            @Value("${OPENROUTER_API_KEY_FILE:/run/secrets/openrouter_api_key}") String apiKeyFilePath,
            @Value("${carbonengine.openrouter.base-url:https://openrouter.ai/api/v1}") String baseUrl,
            @Value("${carbonengine.openrouter.referer:http://localhost}") String referer,
            @Value("${carbonengine.openrouter.title:carbon-engine}") String title,
            @Value("${carbonengine.openrouter.timeout.ms:20000}") int timeoutMs
    ) {
        this(resolveApiKey(envKey, apiKeyFilePath), baseUrl, referer, title, buildRestTemplate(timeoutMs));
    }

    OpenRouterChatAdapter(String apiKey, String baseUrl, String referer, String title, RestTemplate rest) {
        this.apiKey = apiKey;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.referer = referer;
        this.title = title;
        this.rest = rest;
        log.debug("OpenRouterChatAdapter init: baseUrl={}, referer={}, title={}", this.baseUrl, this.referer, this.title);
    }

    @Override
    public String provider() { return "openrouter"; }

    @Override
    public String chat(String systemPrompt, String userPrompt, String model) {
        return chatWithUsage(systemPrompt, userPrompt, model).text();
    }

    @Override
    @SuppressWarnings("rawtypes")
    public ChatResult chatWithUsage(String systemPrompt, String userPrompt, String model) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new BackendUnavailableException("OpenRouter API key not configured. Set OPENROUTER_API_KEY or mount OPENROUTER_API_KEY_FILE.");
        }
        final String url = baseUrl + "/chat/completions";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);
        headers.set("HTTP-Referer", referer);
        headers.set("X-Title", title);

        Map<String, Object> body = Map.of(
                "model", model,
                "temperature", 0,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)
                )
        );

        long t0 = System.nanoTime();
        try {
            ResponseEntity<Map> response = rest.postForEntity(url, new HttpEntity<>(body, headers), Map.class);
            long latencyMs = Math.max(1L, Math.round((System.nanoTime() - t0) / 1_000_000.0));

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new BackendUnavailableException("OpenRouter call failed: status=" + response.getStatusCode().value()
                        + " body=" + response.getBody());
            }

            String content = "";
            Object choices = response.getBody().get("choices");
            if (choices instanceof List<?> list && !list.isEmpty()) {
                Object first = list.get(0);
                if (first instanceof Map<?, ?> m) {
                    Object message = m.get("message");
                    if (message instanceof Map<?, ?> mm) {
                        Object c = mm.get("content");
                        if (c != null) content = String.valueOf(c);
                    }
                }
            }
            if (content.isEmpty()) {
                log.warn("OpenRouter response missing choices[0].message.content. Raw body={}", response.getBody());
            }

            // usage (real values only; may be null)
            Usage usageObj = null;
            Object usage = response.getBody().get("usage");
            if (usage instanceof Map<?, ?> u) {
                Integer pt = u.get("prompt_tokens") instanceof Number p ? p.intValue() : null;
                Integer ct = u.get("completion_tokens") instanceof Number c ? c.intValue() : null;
                if (pt != null || ct != null) usageObj = new Usage(pt, ct);
            }
            log.debug("OpenRouter model={} answered in {} ms (usage={})", model, latencyMs, usageObj);

            return new ChatResult(content, usageObj);

        } catch (HttpClientErrorException | HttpServerErrorException ex) {
            log.error("OpenRouter HTTP {} {} for model='{}'\nResponse body: {}",
                    ex.getStatusCode().value(), ex.getStatusText(), model, ex.getResponseBodyAsString());
            if (ex.getStatusCode() == HttpStatus.UNAUTHORIZED) {
                throw new BackendUnavailableException("OpenRouter 401 Unauthorized. Check API key, required headers, and model access.", ex);
            }
            throw new BackendUnavailableException("OpenRouter error: " + ex.getStatusCode().value() + " " + ex.getStatusText(), ex);
        } catch (ResourceAccessException io) {
            log.error("OpenRouter connection error to {}: {}", url, io.toString());
            throw new BackendUnavailableException("Cannot reach OpenRouter (" + baseUrl + "). Check network / URL / timeouts.", io);
        } catch (RestClientException ex) {
            // unreadable bodies, unexpected content types, unknown status codes
            log.error("OpenRouter call for model='{}' failed: {}", model, ex.toString());
            throw new BackendUnavailableException("OpenRouter call failed: " + ex.getMessage(), ex);
        }
    }

    // ---- helpers ----

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout(timeoutMs);
        f.setReadTimeout(timeoutMs);
        return new RestTemplate(f);
    }

    private static String trimTrailingSlash(String s) {
        if (s == null) return "";
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    static String resolveApiKey(String envKey, String filePath) {
        String key = envKey == null ? "" : envKey.trim();
        if (!key.isBlank()) return key;
        Path path = Path.of(filePath);
        if (!Files.exists(path)) return "";
        try {
            return Files.readString(path, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.warn("Could not read OpenRouter key file {}: {}", filePath, e.getMessage());
            return "";
        }
    }
}

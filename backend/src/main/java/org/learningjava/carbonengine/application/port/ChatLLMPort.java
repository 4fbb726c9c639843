package org.learningjava.carbonengine.application.port;

public interface ChatLLMPort {
    String provider();

    String chat(String systemPrompt, String userPrompt, String model);

    default ChatResult chatWithUsage(String systemPrompt, String userPrompt, String model) {
        // default: no usage reported
        return new ChatResult(chat(systemPrompt, userPrompt, model), null);
    }

    record Usage(Integer promptTokens, Integer completionTokens) {}
    record ChatResult(String text, Usage usage) {}
}

package org.learningjava.carbonengine.domain.service;

import org.learningjava.carbonengine.application.port.ChatLLMPort;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** Chat providers by name ("openrouter", "ollama"), matched case-insensitively. */
@Component
public class ChatRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChatRegistry.class);

    private final Map<String, ChatLLMPort> providers = new TreeMap<>();

    public ChatRegistry(List<ChatLLMPort> adapters) {
        for (ChatLLMPort adapter : adapters) {
            ChatLLMPort previous = providers.put(key(adapter.provider()), adapter);
            if (previous != null) {
                log.warn("Chat provider '{}' registered twice, keeping {}", adapter.provider(),
                        adapter.getClass().getSimpleName());
            }
        }
        log.info("Chat providers: {}", providers.keySet());
    }

    /** The provider used by extraction and the assistant backend; unknown names are a backend outage. */
    public ChatLLMPort require(String name) {
        ChatLLMPort chat = providers.get(key(name));
        if (chat == null) {
            throw new BackendUnavailableException("Unknown chat provider: " + name + " (known: " + providers.keySet() + ")");
        }
        return chat;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}

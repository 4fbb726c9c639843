package org.learningjava.carbonengine.infrastructure.adapter.out.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.carbonengine.application.port.ActivityExtractionPort;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.model.activity.ExtractedActivity;
import org.learningjava.carbonengine.domain.service.ChatRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Free-text extraction through a chat model that is asked to answer with a single JSON object.
 */
@Component
public class LlmActivityExtractionAdapter implements ActivityExtractionPort {

    private static final Logger log = LoggerFactory.getLogger(LlmActivityExtractionAdapter.class);

    static final String SYSTEM_PROMPT =
            "You are a precise data extractor. Return only valid JSON. Focus on the specific fuel or energy type.";

    private static final String USER_PROMPT = """
            Parse the activity below and return ONLY a JSON object with these fields:
            {
              "category": "fuel|electricity|transport|heating|waste|water|other",
              "subcategory": "specific type, e.g. diesel, petrol, natural gas, electricity grid",
              "fuel_type": "if applicable, e.g. diesel, petrol, natural gas",
              "quantity": number,
              "unit": "unit as written (L, liters, kWh, km, m3, kg, ...)",
              "description": "short description for factor matching, naming the fuel or energy type",
              "confidence": number between 0 and 1
            }
            Treat petrol and gasoline as the same fuel.

            Activity: "%s"
            """;

    private final ChatRegistry chats;
    private final EngineProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public LlmActivityExtractionAdapter(ChatRegistry chats, EngineProperties props) {
        this.chats = chats;
        this.props = props;
    }

    @Override
    public ExtractedActivity extract(String rawText) {
        String provider = props.getLlm().getProvider();
        String model = props.getLlm().getExtractionModel();
        String reply = chats.require(provider)
                .chat(SYSTEM_PROMPT, USER_PROMPT.formatted(rawText.replace("\"", "'")), model);

        if (log.isDebugEnabled()) {
            log.debug("Extraction reply ({} / {}): {}", provider, model, reply);
        }
        return parse(reply);
    }

    ExtractedActivity parse(String reply) {
        JsonNode json;
        try {
            json = om.readTree(JsonReplies.extractObject(reply));
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException("Extraction reply is not JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw new BackendUnavailableException("Extraction reply is not a JSON object");
        }

        return new ExtractedActivity(
                JsonReplies.text(json, "category"),
                JsonReplies.text(json, "subcategory"),
                JsonReplies.text(json, "fuel_type", "fuelType"),
                JsonReplies.number(json, "quantity"),
                JsonReplies.text(json, "unit"),
                JsonReplies.text(json, "description"),
                JsonReplies.number(json, "confidence")
        );
    }
}

package org.learningjava.carbonengine.infrastructure.adapter.out.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.carbonengine.application.port.AssistantPort;
import org.learningjava.carbonengine.config.EngineProperties;
import org.learningjava.carbonengine.domain.exception.BackendUnavailableException;
import org.learningjava.carbonengine.domain.model.factor.GhgBreakdown;
import org.learningjava.carbonengine.domain.service.ChatRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class LlmAssistantAdapter implements AssistantPort {

    private static final Logger log = LoggerFactory.getLogger(LlmAssistantAdapter.class);

    static final String SYSTEM_PROMPT = """
            You are a greenhouse-gas accounting assistant following the GHG Protocol.
            Given an activity, pick a well-known published emission factor (DEFRA, EPA, IPCC or similar)
            and answer with ONLY a JSON object:
            {
              "emission_factor": number (kg CO2e per unit),
              "emission_factor_unit": "kg CO2e/<unit>",
              "total_emissions": number (kg CO2e) or null,
              "scope": "Scope 1|Scope 2|Scope 3",
              "source": "name of the factor source",
              "confidence": number between 0 and 1,
              "breakdown": {"co2": number, "ch4": number, "n2o": number} or null
            }""";

    private final ChatRegistry chats;
    private final EngineProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public LlmAssistantAdapter(ChatRegistry chats, EngineProperties props) {
        this.chats = chats;
        this.props = props;
    }

    @Override
    public AssistantEstimate structuredCalculate(String description, List<String> hints) {
        StringBuilder user = new StringBuilder("Activity: ").append(description).append('\n');
        if (hints != null && !hints.isEmpty()) {
            user.append("Known fields: ").append(String.join(", ", hints)).append('\n');
        }

        String model = props.getLlm().getAssistantModel();
        String reply = chats.require(props.getLlm().getProvider()).chat(SYSTEM_PROMPT, user.toString(), model);
        if (log.isDebugEnabled()) {
            log.debug("Assistant reply ({}): {}", model, reply);
        }
        return parse(reply);
    }

    AssistantEstimate parse(String reply) {
        JsonNode json;
        try {
            json = om.readTree(JsonReplies.extractObject(reply));
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException("Assistant reply is not JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw new BackendUnavailableException("Assistant reply is not a JSON object");
        }

        Double factor = JsonReplies.number(json, "emission_factor", "emissionFactor");
        if (factor == null) {
            throw new BackendUnavailableException("Assistant reply has no emission_factor");
        }

        GhgBreakdown breakdown = null;
        JsonNode b = json.get("breakdown");
        if (b != null && b.isObject()) {
            breakdown = new GhgBreakdown(
                    JsonReplies.number(b, "co2"), JsonReplies.number(b, "ch4"), JsonReplies.number(b, "n2o"));
        }

        return new AssistantEstimate(
                factor,
                JsonReplies.text(json, "emission_factor_unit", "emissionFactorUnit"),
                JsonReplies.number(json, "total_emissions", "totalEmissions"),
                JsonReplies.text(json, "scope"),
                JsonReplies.text(json, "source"),
                JsonReplies.number(json, "confidence"),
                breakdown
        );
    }
}

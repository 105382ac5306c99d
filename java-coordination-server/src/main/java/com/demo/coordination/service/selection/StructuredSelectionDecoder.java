package com.demo.coordination.service.selection;

import com.demo.coordination.domain.ModeratorDecision;
import com.demo.coordination.domain.ResponderRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON answers of the form {@code {"message": "...", "ai_id": "..."}},
 * optionally wrapped in a markdown code fence.
 */
@Component
@Order(1)
@Slf4j
@RequiredArgsConstructor
public class StructuredSelectionDecoder implements SelectionDecoder {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    @Override
    public Optional<ModeratorDecision> decode(String moderatorOutput) {
        if (moderatorOutput == null) {
            return Optional.empty();
        }
        String json = stripFence(moderatorOutput.trim());
        if (!json.startsWith("{")) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Moderator output is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (!root.isObject()) {
            return Optional.empty();
        }

        String message = root.path("message").asText("");
        JsonNode aiId = root.get("ai_id");
        ResponderRef selection = null;
        if (aiId != null && aiId.isTextual() && !aiId.asText().isBlank()) {
            selection = ResponderRef.byId(aiId.asText());
        }
        return Optional.of(new ModeratorDecision(message, selection));
    }

    static String stripFence(String text) {
        String result = text;
        if (result.startsWith(JSON_FENCE)) {
            result = result.substring(JSON_FENCE.length());
        } else if (result.startsWith(FENCE)) {
            result = result.substring(FENCE.length());
        }
        if (result.endsWith(FENCE)) {
            result = result.substring(0, result.length() - FENCE.length());
        }
        return result.trim();
    }
}

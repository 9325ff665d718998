package com.ryuqq.discovery.adapter.sqlite.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.discovery.core.exception.SessionStoreException;
import com.ryuqq.discovery.core.model.SessionParams;

/**
 * JSON form of {@link SessionParams} stored in the {@code params} column.
 *
 * <pre>
 * {"max_papers":20,"max_hypotheses":10,"iterations":3,"ai_model":"gemini"}
 * </pre>
 *
 * <p>Missing fields fall back to the defaults of {@link SessionParams}.</p>
 */
final class SessionParamsCodec {

    private final ObjectMapper mapper;

    SessionParamsCodec() {
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    String toJson(SessionParams params) {
        ObjectNode node = mapper.createObjectNode();
        node.put("max_papers", params.maxPapers());
        node.put("max_hypotheses", params.maxHypotheses());
        node.put("iterations", params.iterations());
        node.put("ai_model", params.aiModel());
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to serialize session params", e);
        }
    }

    SessionParams fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new SessionParams();
        }
        try {
            JsonNode node = mapper.readTree(json);
            return new SessionParams(
                node.path("max_papers").asInt(SessionParams.DEFAULT_MAX_PAPERS),
                node.path("max_hypotheses").asInt(SessionParams.DEFAULT_MAX_HYPOTHESES),
                node.path("iterations").asInt(SessionParams.DEFAULT_ITERATIONS),
                node.path("ai_model").asText(SessionParams.DEFAULT_AI_MODEL)
            );
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to deserialize session params: " + json, e);
        }
    }
}

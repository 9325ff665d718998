package com.ryuqq.discovery.adapter.runner.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.discovery.core.exception.DiscoveryException;
import com.ryuqq.discovery.core.model.Payload;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.spi.ResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 세션 결과를 {@code <resultsDir>/<sessionId>/summary.json}으로 저장합니다.
 *
 * <pre>
 * {
 *   "session_id": "session_20240501_090000_000_0001",
 *   "topic": "...",
 *   "params": { "max_papers": 20, "max_hypotheses": 10, "iterations": 3, "ai_model": "gemini" },
 *   "created_at": "2024-05-01T09:00:00Z",
 *   "results": { ... 마지막 평가 단계 출력 ... }
 * }
 * </pre>
 *
 * <p>최종 페이로드가 JSON이 아니면 문자열로 저장합니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class JsonFileResultWriter implements ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonFileResultWriter.class);

    static final String SUMMARY_FILE = "summary.json";

    private final Path resultsDir;
    private final ObjectMapper mapper;

    public JsonFileResultWriter(Path resultsDir) {
        if (resultsDir == null) {
            throw new IllegalArgumentException("resultsDir cannot be null");
        }
        this.resultsDir = resultsDir;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String write(Session session, Payload finalOutput) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        Path sessionDir = resultsDir.resolve(session.id().getValue());
        Path summary = sessionDir.resolve(SUMMARY_FILE);

        ObjectNode root = mapper.createObjectNode();
        root.put("session_id", session.id().getValue());
        root.put("topic", session.topic());
        ObjectNode params = root.putObject("params");
        params.put("max_papers", session.params().maxPapers());
        params.put("max_hypotheses", session.params().maxHypotheses());
        params.put("iterations", session.params().iterations());
        params.put("ai_model", session.params().aiModel());
        root.put("created_at", session.createdAt().toString());
        root.set("results", toNode(finalOutput));

        try {
            Files.createDirectories(sessionDir);
            mapper.writeValue(summary.toFile(), root);
        } catch (IOException e) {
            throw new DiscoveryException("Failed to write results for session " + session.id() + " to " + summary, e);
        }
        log.debug("Wrote {}", summary);
        return summary.toString();
    }

    private JsonNode toNode(Payload payload) {
        if (payload == null || payload.isEmpty()) {
            return mapper.nullNode();
        }
        try {
            return mapper.readTree(payload.json());
        } catch (JsonProcessingException e) {
            log.debug("Final output is not JSON, storing it as text");
            return mapper.getNodeFactory().textNode(payload.json());
        }
    }
}

package com.sgw.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Coordinator to worker: run {@code action} against {@code sessionId} and reply with {@code requestId}.
 */
public record WorkerCommand(Action action, String requestId, String sessionId, JsonNode payload) {

    public String text(String field) {
        return payload == null ? null : payload.path(field).asText(null);
    }
}

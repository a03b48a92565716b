package com.sgw.worker.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.protocol.Envelopes;

import java.time.Instant;
import java.util.Base64;

/**
 * One durable record per session: the opaque credential blob plus a diagnostic status marker.
 *
 * JSON layout:
 * <pre>
 *   { "id": "...", "status": "connected", "updatedAt": "2024-01-01T00:00:00Z",
 *     "authData": { "type": "Buffer", "data": "&lt;base64&gt;" } }
 * </pre>
 * The status and timestamp are for operators only; nothing routes on them.
 */
public record CredentialRecord(String id, String status, Instant updatedAt, byte[] blob) {

    private static final String BUFFER_TAG = "Buffer";

    public ObjectNode toJson() {
        ObjectNode node = Envelopes.object()
                .put("id", id)
                .put("status", status)
                .put("updatedAt", updatedAt.toString());
        if (blob != null) {
            node.putObject("authData")
                    .put("type", BUFFER_TAG)
                    .put("data", Base64.getEncoder().encodeToString(blob));
        }
        return node;
    }

    public static CredentialRecord fromJson(JsonNode node) {
        JsonNode auth = node.path("authData");
        byte[] blob = null;
        if (BUFFER_TAG.equals(auth.path("type").asText()) && auth.hasNonNull("data")) {
            blob = Base64.getDecoder().decode(auth.get("data").asText());
        }
        String updatedAt = node.path("updatedAt").asText(null);
        return new CredentialRecord(
                node.path("id").asText(),
                node.path("status").asText("unknown"),
                updatedAt != null ? Instant.parse(updatedAt) : Instant.EPOCH,
                blob);
    }
}

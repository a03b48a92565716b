package com.sgw.worker.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.protocol.Envelopes;

/**
 * Best-effort summary of a message body: its text, or a typed placeholder for media.
 */
public record MessageContent(String type, String text, String caption) {

    private static final String[][] MEDIA_KINDS = {
            {"imageMessage",    "image"},
            {"videoMessage",    "video"},
            {"documentMessage", "document"},
            {"audioMessage",    "audio"},
            {"stickerMessage",  "sticker"},
    };

    public static MessageContent extract(JsonNode m) {
        if (m == null || m.isNull()) return unknown();
        if (m.hasNonNull("conversation")) {
            return new MessageContent("text", m.get("conversation").asText(), null);
        }
        JsonNode extended = m.path("extendedTextMessage");
        if (extended.hasNonNull("text")) {
            return new MessageContent("text", extended.get("text").asText(), null);
        }
        for (String[] kind : MEDIA_KINDS) {
            JsonNode media = m.path(kind[0]);
            if (!media.isMissingNode() && !media.isNull()) {
                return new MessageContent(kind[1], null, media.path("caption").asText(""));
            }
        }
        return unknown();
    }

    public static MessageContent unknown() {
        return new MessageContent("unknown", null, null);
    }

    public ObjectNode toJson() {
        ObjectNode node = Envelopes.object().put("type", type);
        if (text != null) node.put("text", text);
        if (caption != null) node.put("caption", caption);
        return node;
    }
}

package com.sgw.worker.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.protocol.Envelopes;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageContentTest {

    private static JsonNode json(String s) throws Exception {
        return Envelopes.MAPPER.readTree(s);
    }

    @Test
    void plainConversation() throws Exception {
        MessageContent c = MessageContent.extract(json("{\"conversation\":\"hello\"}"));
        assertEquals("text", c.type());
        assertEquals("hello", c.text());
    }

    @Test
    void extendedText() throws Exception {
        MessageContent c = MessageContent.extract(json("{\"extendedTextMessage\":{\"text\":\"link https://x\"}}"));
        assertEquals("text", c.type());
        assertEquals("link https://x", c.text());
    }

    @Test
    void mediaBecomesPlaceholderWithCaption() throws Exception {
        MessageContent image = MessageContent.extract(json("{\"imageMessage\":{\"caption\":\"beach\"}}"));
        assertEquals("image", image.type());
        assertNull(image.text());
        assertEquals("beach", image.caption());

        MessageContent doc = MessageContent.extract(json("{\"documentMessage\":{}}"));
        assertEquals("document", doc.type());
        assertEquals("", doc.caption());
    }

    @Test
    void unknownShapes() throws Exception {
        assertEquals("unknown", MessageContent.extract(null).type());
        assertEquals("unknown", MessageContent.extract(json("{\"reactionMessage\":{}}")).type());
    }

    @Test
    void jsonOmitsAbsentFields() {
        ObjectNode node = new MessageContent("text", "hi", null).toJson();
        assertEquals("text", node.get("type").asText());
        assertEquals("hi", node.get("text").asText());
        assertFalse(node.has("caption"));
    }

    @Test
    void identityStripsDeviceAndDomain() {
        assertEquals("15551234", new ProtocolEvent.Opened("15551234:7@s.whatsapp.net", null).identity());
        assertEquals("15551234", new ProtocolEvent.Opened("15551234@s.whatsapp.net", null).identity());
        assertEquals("unknown", new ProtocolEvent.Opened(null, null).identity());
    }
}

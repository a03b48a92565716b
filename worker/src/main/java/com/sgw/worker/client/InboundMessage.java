package com.sgw.worker.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An inbound message as delivered by the protocol client.
 *
 * @param message   the raw message body, keyed by message kind ({@code conversation}, {@code imageMessage}, ...)
 * @param timestamp seconds since the epoch, as reported by the remote service
 */
public record InboundMessage(String id, String from, boolean fromMe, long timestamp, JsonNode message) {

    public MessageContent content() {
        return MessageContent.extract(message);
    }
}

package com.sgw.protocol;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.agrona.DirectBuffer;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON codec for coordinator/worker envelopes.
 *
 * Cross-process layout (one Aeron message per envelope):
 *   [N bytes: UTF-8 JSON of WorkerCommand or WorkerSignal]
 *
 * The stream id tells the direction, so no type byte is needed.
 */
public final class Envelopes {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Envelopes() {}

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    public static byte[] encode(WorkerCommand command) {
        return write(command);
    }

    public static byte[] encode(WorkerSignal signal) {
        return write(signal);
    }

    public static WorkerCommand decodeCommand(DirectBuffer buffer, int offset, int length) {
        return read(buffer, offset, length, WorkerCommand.class);
    }

    public static WorkerSignal decodeSignal(DirectBuffer buffer, int offset, int length) {
        return read(buffer, offset, length, WorkerSignal.class);
    }

    public static WorkerCommand decodeCommand(byte[] bytes) {
        return read(bytes, WorkerCommand.class);
    }

    public static WorkerSignal decodeSignal(byte[] bytes) {
        return read(bytes, WorkerSignal.class);
    }

    private static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(DirectBuffer buffer, int offset, int length, Class<T> type) {
        byte[] bytes = new byte[length];
        buffer.getBytes(offset, bytes);
        return read(bytes, type);
    }

    private static <T> T read(byte[] bytes, Class<T> type) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}

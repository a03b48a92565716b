package com.sgw.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Worker to coordinator. Either a reply to a {@link WorkerCommand}, or an ownership
 * claim/release for a session.
 *
 * Every signal carries the worker index and generation that produced it, so the
 * coordinator can discard signals from a worker incarnation it has already replaced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerSignal(Type type,
                           int workerIndex,
                           long generation,
                           String requestId,
                           String sessionId,
                           boolean success,
                           JsonNode data,
                           String error,
                           ErrorKind errorKind) {

    public enum Type { REPLY, CLAIM, RELEASE }

    public static WorkerSignal reply(int workerIndex, long generation, String requestId,
                                     String sessionId, JsonNode data) {
        return new WorkerSignal(Type.REPLY, workerIndex, generation, requestId, sessionId, true, data, null, null);
    }

    public static WorkerSignal failure(int workerIndex, long generation, String requestId,
                                       String sessionId, ErrorKind kind, String error) {
        return new WorkerSignal(Type.REPLY, workerIndex, generation, requestId, sessionId, false, null, error, kind);
    }

    public static WorkerSignal claim(int workerIndex, long generation, String sessionId) {
        return new WorkerSignal(Type.CLAIM, workerIndex, generation, null, sessionId, true, null, null, null);
    }

    public static WorkerSignal release(int workerIndex, long generation, String sessionId) {
        return new WorkerSignal(Type.RELEASE, workerIndex, generation, null, sessionId, true, null, null, null);
    }
}

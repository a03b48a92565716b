package com.sgw.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.protocol.Action;
import com.sgw.protocol.WorkerSignal;

import java.util.concurrent.CompletableFuture;

/**
 * What the control surface needs from the coordinator.
 */
public interface SessionRouter {

    /**
     * Routes the action to the worker owning (or about to own) the session. The future
     * always completes normally with the worker's reply or a synthesized failure.
     */
    CompletableFuture<WorkerSignal> forward(String sessionId, Action action, JsonNode payload);

    CompletableFuture<ObjectNode> health();
}

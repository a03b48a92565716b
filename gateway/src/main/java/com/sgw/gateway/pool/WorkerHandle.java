package com.sgw.gateway.pool;

import com.sgw.protocol.WorkerCommand;

import java.util.concurrent.CompletableFuture;

/**
 * Coordinator-side handle on one worker incarnation.
 */
public interface WorkerHandle {

    int index();

    long generation();

    /**
     * @return false when the command could not be handed over (worker stopping, transport down)
     * @throws IllegalArgumentException when the command is too large for the transport
     */
    boolean send(WorkerCommand command);

    /** Completes once this incarnation is gone, whatever the cause. */
    CompletableFuture<Void> exitFuture();

    /** Graceful stop: resident sessions are closed without logging out. */
    void stop();

    /** Abrupt stop, as if the worker crashed. */
    void kill();
}

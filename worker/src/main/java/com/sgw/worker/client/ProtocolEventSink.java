package com.sgw.worker.client;

/**
 * Receives events from a {@link ProtocolClient}. May be called from any thread.
 */
@FunctionalInterface
public interface ProtocolEventSink {
    void emit(ProtocolEvent event);
}

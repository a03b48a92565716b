package com.sgw.worker.client;

/**
 * Creates protocol handles. Implementations register through
 * {@code META-INF/services/com.sgw.worker.client.ProtocolClientFactory} and are selected by {@link #name()}.
 */
public interface ProtocolClientFactory {

    String name();

    ProtocolClient create(String sessionId);
}

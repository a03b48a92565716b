package com.sgw.worker.client;

import java.util.concurrent.CompletableFuture;

/**
 * One handle onto the remote messaging service for a single session.
 *
 * A handle is used for exactly one connect attempt. Lifecycle and inbound traffic are
 * reported as {@link ProtocolEvent}s through the sink passed to {@link #connect};
 * the returned futures complete on the client's own threads.
 */
public interface ProtocolClient extends AutoCloseable {

    /**
     * Starts the handshake. Completes exceptionally when the attempt fails before
     * any event could be emitted; everything after that arrives as events.
     *
     * @param storedCredentials the last persisted credential blob, or null for a fresh pairing
     */
    CompletableFuture<Void> connect(byte[] storedCredentials, ProtocolEventSink sink);

    /**
     * Fails with {@link RecipientUnreachableException} for recipient problems, and with
     * {@link java.util.concurrent.TimeoutException} or {@link java.io.IOException} for transport problems.
     */
    CompletableFuture<SendReceipt> sendText(String jid, String text);

    CompletableFuture<SendReceipt> sendMedia(String jid, byte[] media, String caption);

    /** Revokes the pairing on the remote side. */
    CompletableFuture<Void> logout();

    /** Drops the connection without logging out. Idempotent. */
    @Override
    void close();
}

package com.sgw.worker.client;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Local development stand-in for the remote service.
 *
 * Without stored credentials it publishes a synthetic pairing code, "pairs" after
 * {@link #PAIR_DELAY_MS}, rotates credentials and opens. With stored credentials it
 * opens straight away. Sends are acknowledged with a random id.
 */
public final class LoopbackProtocolClient implements ProtocolClient {

    private static final Logger log = LoggerFactory.getLogger(LoopbackProtocolClient.class);

    static final long PAIR_DELAY_MS    = 3_000;
    static final long RESUME_DELAY_MS  = 200;

    private final String sessionId;
    private final EventExecutor executor;
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();
    private volatile boolean closed;

    public LoopbackProtocolClient(String sessionId, EventExecutor executor) {
        this.sessionId = sessionId;
        this.executor  = executor;
    }

    @Override
    public CompletableFuture<Void> connect(byte[] storedCredentials, ProtocolEventSink sink) {
        if (storedCredentials == null) {
            String code = "loopback:" + sessionId + ":" + UUID.randomUUID();
            executor.execute(() -> sink.emit(new ProtocolEvent.PairingCode(code)));
            schedule(PAIR_DELAY_MS, () -> {
                byte[] creds = ("creds:" + sessionId).getBytes(StandardCharsets.UTF_8);
                sink.emit(new ProtocolEvent.CredentialsRotated(creds));
                sink.emit(new ProtocolEvent.Opened(fakeUserId(), "Loopback"));
            });
        } else {
            schedule(RESUME_DELAY_MS, () -> sink.emit(new ProtocolEvent.Opened(fakeUserId(), "Loopback")));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<SendReceipt> sendText(String jid, String text) {
        log.debug("[{}] loopback send to {}: {}", sessionId, jid, text);
        return CompletableFuture.completedFuture(new SendReceipt(UUID.randomUUID().toString()));
    }

    @Override
    public CompletableFuture<SendReceipt> sendMedia(String jid, byte[] media, String caption) {
        log.debug("[{}] loopback media to {}: {} bytes", sessionId, jid, media.length);
        return CompletableFuture.completedFuture(new SendReceipt(UUID.randomUUID().toString()));
    }

    @Override
    public CompletableFuture<Void> logout() {
        close();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized void close() {
        closed = true;
        timers.forEach(t -> t.cancel(false));
        timers.clear();
    }

    private synchronized void schedule(long delayMs, Runnable task) {
        if (closed) return;
        timers.add(executor.schedule(() -> {
            if (!closed) task.run();
        }, delayMs, TimeUnit.MILLISECONDS));
    }

    private String fakeUserId() {
        return "1555" + ThreadLocalRandom.current().nextInt(1_000_000, 9_999_999) + ":1@s.whatsapp.net";
    }

    public static final class Factory implements ProtocolClientFactory {

        @Override
        public String name() { return "loopback"; }

        @Override
        public ProtocolClient create(String sessionId) {
            return new LoopbackProtocolClient(sessionId, GlobalEventExecutor.INSTANCE);
        }
    }
}

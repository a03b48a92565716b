package com.sgw.worker.session;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.common.GatewayConfig;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.ErrorKind;
import com.sgw.protocol.SessionStatus;
import com.sgw.worker.ActionException;
import com.sgw.worker.client.CloseCodes;
import com.sgw.worker.client.InboundMessage;
import com.sgw.worker.client.PairingCodeRenderer;
import com.sgw.worker.client.ProtocolClient;
import com.sgw.worker.client.ProtocolClientFactory;
import com.sgw.worker.client.ProtocolEvent;
import com.sgw.worker.notify.Notifier;
import com.sgw.worker.notify.WebhookEvent;
import com.sgw.worker.store.CredentialStoreException;
import com.sgw.worker.store.PersistenceCoordinator;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Connection lifecycle of one session against the protocol client.
 *
 * <pre>
 *   INITIALIZING -> QR_READY -> CONNECTED -> RECONNECTING -> CONNECTED | TERMINATED
 *   QR_READY -> EXPIRED (pairing window elapsed; resting until restarted)
 *   any -> LOGGED_OUT (absorbing)
 * </pre>
 *
 * Exactly one protocol handle is live at a time: every connect attempt tears the previous
 * one down first, and events from a torn-down handle are discarded by its channel.
 * A pending reconnect blocks further close handling, so overlapping closures cannot
 * start parallel handshakes.
 *
 * Confined to the owning worker's event loop. Nothing here blocks except the
 * credential load at the start of each connect attempt.
 */
public final class SessionMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionMachine.class);

    /** Called once when the session leaves its worker on its own (logout, give-up). */
    @FunctionalInterface
    public interface TerminationListener {
        void onTerminated(SessionMachine session);
    }

    private final String sessionId;
    private final GatewayConfig cfg;
    private final EventExecutor loop;
    private final ProtocolClientFactory clients;
    private final PersistenceCoordinator persistence;
    private final Notifier notifier;
    private final PairingCodeRenderer renderer;
    private final ReconnectPolicy policy;
    private final MessageDeduplicator dedup;
    private final TerminationListener terminationListener;

    private SessionStatus status = SessionStatus.INITIALIZING;
    private String  pairingCode;
    private long    pairingExpiresAt;
    private String  identity;
    private int     reconnectAttempts;
    private int     conflictAttempts;
    private long    connectedAt;
    private boolean stable;
    private long    connectionEpoch;
    private boolean reconnectPending;
    private boolean terminated;

    private ProtocolClient      client;
    private SessionEventChannel channel;
    private ScheduledFuture<?>  pairingTimer;
    private ScheduledFuture<?>  reconnectTimer;
    private CompletableFuture<Void> disconnecting;

    private final List<CompletableFuture<Void>> connectWaiters = new ArrayList<>();

    public SessionMachine(String sessionId, GatewayConfig cfg, EventExecutor loop,
                          ProtocolClientFactory clients, PersistenceCoordinator persistence,
                          Notifier notifier, PairingCodeRenderer renderer,
                          TerminationListener terminationListener) {
        this.sessionId           = sessionId;
        this.cfg                 = cfg;
        this.loop                = loop;
        this.clients             = clients;
        this.persistence         = persistence;
        this.notifier            = notifier;
        this.renderer            = renderer;
        this.policy              = ReconnectPolicy.fromConfig(cfg);
        this.dedup               = new MessageDeduplicator(cfg.dedupWindowMs, cfg.dedupMaxEntries);
        this.terminationListener = terminationListener;
    }

    public String sessionId() { return sessionId; }

    public SessionStatus status() { return status; }

    public boolean isTerminated() { return terminated; }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, status, identity, pairingCode, pairingExpiresAt,
                reconnectAttempts + conflictAttempts, stable, connectedAt);
    }

    /** The live handle while connected, else null. */
    public ProtocolClient connectedClient() {
        return status == SessionStatus.CONNECTED ? client : null;
    }

    // ---- Commands (called by the worker) ----

    public void start() {
        log.info("[{}] starting", sessionId);
        connect();
    }

    /** Fresh attempt for a session resting in EXPIRED. */
    public void restart() {
        if (terminated) return;
        log.info("[{}] restarting from {}", sessionId, status.wireName);
        cancelTimers();
        reconnectAttempts = 0;
        conflictAttempts  = 0;
        pairingCode       = null;
        setStatus(SessionStatus.INITIALIZING);
        connect();
    }

    /**
     * Completes once the session is connected, or fails with NOT_CONNECTED after
     * {@code ceilingMs}. Signalled by the transition into CONNECTED; no polling.
     */
    public CompletableFuture<Void> awaitConnected(long ceilingMs) {
        if (terminated) {
            return CompletableFuture.failedFuture(new ActionException(ErrorKind.NOT_AVAILABLE, "session not active"));
        }
        if (status == SessionStatus.CONNECTED && client != null) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> waiter = new CompletableFuture<>();
        connectWaiters.add(waiter);
        ScheduledFuture<?> timer = loop.schedule(() -> {
            if (connectWaiters.remove(waiter)) {
                waiter.completeExceptionally(new ActionException(ErrorKind.NOT_CONNECTED,
                        "session did not connect within " + ceilingMs + "ms"));
            }
        }, ceilingMs, TimeUnit.MILLISECONDS);
        waiter.whenComplete((v, err) -> timer.cancel(false));
        return waiter;
    }

    /**
     * Best-effort logout, then unconditional teardown. The returned future always
     * completes normally, on the worker loop.
     */
    public CompletableFuture<Void> disconnect() {
        if (disconnecting != null) return disconnecting;
        ProtocolClient c = client;
        if (channel != null) {
            // the logout's own close event must not drive the state machine
            channel.close();
            channel = null;
        }
        CompletableFuture<Void> logout;
        if (c == null) {
            logout = CompletableFuture.completedFuture(null);
        } else {
            try {
                logout = c.logout();
            } catch (RuntimeException e) {
                logout = CompletableFuture.failedFuture(e);
            }
        }
        disconnecting = logout
                .orTimeout(cfg.logoutTimeoutMs, TimeUnit.MILLISECONDS)
                .handleAsync((v, err) -> {
                    if (err != null) log.warn("[{}] logout failed, removing anyway: {}", sessionId, err.toString());
                    terminate(SessionStatus.LOGGED_OUT, null, null);
                    return null;
                }, loop);
        return disconnecting;
    }

    /** Drops the handle without logging out or notifying; used on worker shutdown. */
    public void close() {
        if (terminated) return;
        terminated = true;
        cancelTimers();
        teardownClient();
        failWaiters(ErrorKind.NOT_AVAILABLE, "worker shutting down");
    }

    // ---- Connect ----

    private void connect() {
        if (terminated) return;
        reconnectPending = false;
        reconnectTimer   = null;
        clearPairing();
        teardownClient();

        byte[] credentials;
        try {
            credentials = persistence.load(sessionId);
        } catch (CredentialStoreException e) {
            log.warn("[{}] cannot load credentials: {}", sessionId, e.getMessage());
            onClosed(new ProtocolEvent.Closed(CloseCodes.HANDSHAKE_FAILED, "credential load failed"));
            return;
        }

        ProtocolClient c;
        try {
            c = clients.create(sessionId);
        } catch (RuntimeException e) {
            log.warn("[{}] protocol client {} failed to create a handle", sessionId, clients.name(), e);
            onClosed(new ProtocolEvent.Closed(CloseCodes.HANDSHAKE_FAILED, "client creation failed"));
            return;
        }
        SessionEventChannel ch = new SessionEventChannel(sessionId, loop, cfg.eventQueueCapacity, this::onEvent);
        client  = c;
        channel = ch;

        CompletableFuture<Void> handshake;
        try {
            handshake = c.connect(credentials, ch);
        } catch (RuntimeException e) {
            handshake = CompletableFuture.failedFuture(e);
        }
        handshake.whenComplete((v, err) -> {
            if (err != null) ch.emit(new ProtocolEvent.Closed(CloseCodes.HANDSHAKE_FAILED, err.toString()));
        });
    }

    // ---- Events (drained from the current handle's channel, on the loop) ----

    void onEvent(ProtocolEvent event) {
        if (terminated) return;
        if (event instanceof ProtocolEvent.PairingCode p) {
            onPairingCode(p);
        } else if (event instanceof ProtocolEvent.Opened o) {
            onOpened(o);
        } else if (event instanceof ProtocolEvent.Closed c) {
            onClosed(c);
        } else if (event instanceof ProtocolEvent.MessageReceived m) {
            onMessage(m.message());
        } else if (event instanceof ProtocolEvent.KeysUpdated k) {
            persistence.softUpdate(sessionId, old -> k.blob());
        } else if (event instanceof ProtocolEvent.CredentialsRotated r) {
            persistence.forceUpdate(sessionId, old -> r.blob()).whenComplete((v, err) -> {
                if (err != null) log.warn("[{}] rotated credentials not persisted: {}", sessionId, err.getMessage());
            });
        } else {
            log.warn("[{}] unhandled protocol event {}", sessionId, event.getClass().getSimpleName());
        }
    }

    private void onPairingCode(ProtocolEvent.PairingCode p) {
        // the first code of an attempt stays valid until it expires
        if (pairingCode != null) return;
        pairingCode      = render(p.code());
        pairingExpiresAt = System.currentTimeMillis() + cfg.qrValidityMs;
        setStatus(SessionStatus.QR_READY);
        log.info("[{}] pairing code ready", sessionId);

        notifier.publish(sessionId, WebhookEvent.PAIRING_READY, Envelopes.object()
                .put("code", pairingCode)
                .put("expiresInSeconds", cfg.qrValidityMs / 1000));

        cancel(pairingTimer);
        pairingTimer = loop.schedule(this::onPairingExpired, cfg.qrValidityMs, TimeUnit.MILLISECONDS);
    }

    private String render(String code) {
        try {
            return renderer.render(code);
        } catch (RuntimeException e) {
            log.warn("[{}] pairing code not rendered, publishing it raw: {}", sessionId, e.toString());
            return code;
        }
    }

    private void onPairingExpired() {
        pairingTimer = null;
        if (terminated || status == SessionStatus.CONNECTED) return;
        log.info("[{}] pairing code expired", sessionId);
        pairingCode = null;
        teardownClient();
        setStatus(SessionStatus.EXPIRED);
        failWaiters(ErrorKind.NOT_CONNECTED, "pairing code expired");
        notifier.publish(sessionId, WebhookEvent.DISCONNECTED, Envelopes.object().put("reason", "qr_expired"));
    }

    private void onOpened(ProtocolEvent.Opened o) {
        clearPairing();
        identity          = o.identity();
        reconnectAttempts = 0;
        conflictAttempts  = 0;
        connectedAt       = System.currentTimeMillis();
        stable            = false;
        long epoch        = ++connectionEpoch;
        setStatus(SessionStatus.CONNECTED);
        log.info("[{}] connected as {}", sessionId, identity);

        loop.schedule(() -> markStable(epoch), cfg.stableDwellMs, TimeUnit.MILLISECONDS);

        ObjectNode data = Envelopes.object().put("identity", identity).put("phone", identity);
        if (o.displayName() != null) data.put("name", o.displayName());
        notifier.publish(sessionId, WebhookEvent.CONNECTED, data);

        List<CompletableFuture<Void>> waiters = new ArrayList<>(connectWaiters);
        connectWaiters.clear();
        waiters.forEach(w -> w.complete(null));
    }

    private void markStable(long epoch) {
        if (terminated || status != SessionStatus.CONNECTED || epoch != connectionEpoch) return;
        stable = true;
        log.info("[{}] connection stable", sessionId);
    }

    private void onClosed(ProtocolEvent.Closed c) {
        if (reconnectPending) {
            log.debug("[{}] close {} ignored, reconnect already scheduled", sessionId, c.code());
            return;
        }
        stable = false;
        connectionEpoch++;
        CloseCategory category = CloseCategory.classify(c.code());
        log.info("[{}] connection closed: code={} reason={} ({})", sessionId, c.code(), c.reason(), category);

        switch (category) {
            case LOGGED_OUT      -> terminate(SessionStatus.LOGGED_OUT, WebhookEvent.LOGGED_OUT, Envelopes.object());
            case DEVICE_CONFLICT -> scheduleReconnect(category, ++conflictAttempts);
            case ORDINARY        -> scheduleReconnect(category, ++reconnectAttempts);
        }
    }

    private void scheduleReconnect(CloseCategory category, int attempt) {
        long delay = policy.delayFor(category, attempt);
        if (delay == ReconnectPolicy.GIVE_UP) {
            log.warn("[{}] giving up after {} reconnect attempts ({})", sessionId, attempt - 1, category);
            String reason = category == CloseCategory.DEVICE_CONFLICT ? "conflict_retries_exhausted" : "max_retries";
            terminate(SessionStatus.TERMINATED, WebhookEvent.DISCONNECTED, Envelopes.object().put("reason", reason));
            return;
        }
        clearPairing();
        teardownClient();
        setStatus(SessionStatus.RECONNECTING);
        reconnectPending = true;
        reconnectTimer   = loop.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
        log.info("[{}] reconnecting in {}ms (attempt {}/{})", sessionId, delay, attempt, policy.maxAttempts(category));
    }

    private void onMessage(InboundMessage msg) {
        if (msg.fromMe() || msg.message() == null || msg.message().isNull()) return;
        if (!dedup.firstSeen(msg.id(), System.currentTimeMillis())) {
            log.debug("[{}] duplicate message {} dropped", sessionId, msg.id());
            return;
        }
        log.info("[{}] new message from {}", sessionId, msg.from());
        ObjectNode data = Envelopes.object()
                .put("id", msg.id())
                .put("from", msg.from())
                .put("timestamp", msg.timestamp());
        data.set("content", msg.content().toJson());
        notifier.publish(sessionId, WebhookEvent.MESSAGE_RECEIVED, data);
    }

    // ---- Internals ----

    /** Single exit path out of the worker; runs at most once. */
    private void terminate(SessionStatus finalStatus, WebhookEvent event, ObjectNode data) {
        if (terminated) return;
        terminated = true;
        cancelTimers();
        teardownClient();
        setStatus(finalStatus);
        failWaiters(ErrorKind.NOT_AVAILABLE, "session " + finalStatus.wireName);
        if (event != null) notifier.publish(sessionId, event, data);
        terminationListener.onTerminated(this);
    }

    /** A pairing code belongs to the attempt that produced it. */
    private void clearPairing() {
        cancel(pairingTimer);
        pairingTimer     = null;
        pairingCode      = null;
        pairingExpiresAt = 0;
    }

    private void teardownClient() {
        if (channel != null) {
            channel.close();
            channel = null;
        }
        if (client != null) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("[{}] error closing protocol client", sessionId, e);
            }
            client = null;
        }
    }

    private void setStatus(SessionStatus next) {
        status = next;
        persistence.markStatus(sessionId, next);
    }

    private void failWaiters(ErrorKind kind, String message) {
        List<CompletableFuture<Void>> waiters = new ArrayList<>(connectWaiters);
        connectWaiters.clear();
        waiters.forEach(w -> w.completeExceptionally(new ActionException(kind, message)));
    }

    private void cancelTimers() {
        cancel(pairingTimer);
        cancel(reconnectTimer);
        pairingTimer     = null;
        reconnectTimer   = null;
        reconnectPending = false;
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) timer.cancel(false);
    }
}

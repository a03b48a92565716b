package com.sgw.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.common.GatewayConfig;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.ErrorKind;
import com.sgw.protocol.SessionStatus;
import com.sgw.protocol.WorkerCommand;
import com.sgw.protocol.WorkerSignal;
import com.sgw.worker.client.PairingCodeRenderer;
import com.sgw.worker.client.ProtocolClient;
import com.sgw.worker.client.ProtocolClientFactory;
import com.sgw.worker.client.RecipientUnreachableException;
import com.sgw.worker.client.SendReceipt;
import com.sgw.worker.notify.Notifier;
import com.sgw.worker.session.SessionMachine;
import com.sgw.worker.store.CredentialStore;
import com.sgw.worker.store.PersistenceCoordinator;
import io.netty.util.concurrent.EventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Hosts one partition of sessions.
 *
 * Single-threaded: every command, protocol event and timer of this worker runs on
 * {@code loop}. Handlers never block it; waits (connect, send, logout) are futures
 * that complete back on the loop. Each command produces exactly one reply.
 *
 * Ownership: a session is claimed as soon as it is created here and released when it
 * leaves (logout, give-up, disconnect). The coordinator's directory is the only reader.
 */
public final class Worker {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final int index;
    private final long generation;
    private final GatewayConfig cfg;
    private final EventExecutor loop;
    private final ProtocolClientFactory clients;
    private final PersistenceCoordinator persistence;
    private final Notifier notifier;
    private final WorkerOutbox outbox;
    private final PairingCodeRenderer renderer;

    // Resident sessions, loop-confined
    private final Map<String, SessionMachine> sessions = new HashMap<>();

    public Worker(int index, long generation, GatewayConfig cfg, EventExecutor loop,
                  ProtocolClientFactory clients, CredentialStore store, Notifier notifier, WorkerOutbox outbox) {
        this.index       = index;
        this.generation  = generation;
        this.cfg         = cfg;
        this.loop        = loop;
        this.clients     = clients;
        this.persistence = new PersistenceCoordinator(store, loop, cfg.persistDebounceMs, cfg.persistRetryDelayMs);
        this.notifier    = notifier;
        this.outbox      = outbox;
        this.renderer    = PairingCodeRenderer.fromConfig(cfg);
    }

    public int index() { return index; }

    public long generation() { return generation; }

    /** Thread-safe: hops onto the worker loop. */
    public void submit(WorkerCommand cmd) {
        try {
            loop.execute(() -> handle(cmd));
        } catch (RejectedExecutionException e) {
            log.warn("Worker {} stopped, dropping {} for [{}]", index, cmd.action().wireName, cmd.sessionId());
        }
    }

    /** Drops every resident session without logging out; pending credential writes are flushed. */
    public CompletableFuture<Void> shutdown() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                for (SessionMachine s : new ArrayList<>(sessions.values())) {
                    s.close();
                    persistence.forget(s.sessionId());
                }
                sessions.clear();
                log.info("Worker {} (gen {}) closed its sessions", index, generation);
                done.complete(null);
            });
        } catch (RejectedExecutionException e) {
            done.complete(null);
        }
        return done;
    }

    /**
     * Crash stand-in: every protocol handle is closed, but nothing is flushed, logged out
     * or signalled. The loop must be shut down right after.
     */
    public void abort() {
        try {
            loop.execute(() -> {
                sessions.values().forEach(SessionMachine::close);
                sessions.clear();
            });
        } catch (RejectedExecutionException e) {
            log.debug("Worker {} already stopped", index);
        }
    }

    // ---- Dispatch ----

    void handle(WorkerCommand cmd) {
        try {
            switch (cmd.action()) {
                case START_SESSION -> startSession(cmd);
                case SEND_TEXT     -> sendText(cmd);
                case SEND_MEDIA    -> sendMedia(cmd);
                case DISCONNECT    -> disconnect(cmd);
                case GET_STATUS    -> getStatus(cmd);
            }
        } catch (ActionException e) {
            fail(cmd, e.kind, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] {} failed", cmd.sessionId(), cmd.action().wireName, e);
            fail(cmd, ErrorKind.INTERNAL, e.toString());
        }
    }

    private void startSession(WorkerCommand cmd) {
        String id = cmd.sessionId();
        SessionMachine existing = sessions.get(id);
        if (existing != null) {
            if (existing.status() == SessionStatus.EXPIRED) existing.restart();
            reply(cmd, statusOnly(existing));
            return;
        }

        SessionMachine session = new SessionMachine(id, cfg, loop, clients, persistence, notifier, renderer,
                this::onTerminated);
        sessions.put(id, session);
        outbox.signal(WorkerSignal.claim(index, generation, id));
        log.info("[{}] created on worker {}", id, index);

        session.start();
        reply(cmd, statusOnly(session));
    }

    private void sendText(WorkerCommand cmd) {
        String to   = required(cmd, "to");
        String text = required(cmd, "text");
        String jid  = normalizeRecipient(to, cfg.recipientDomain);
        send(cmd, c -> c.sendText(jid, text));
    }

    private void sendMedia(WorkerCommand cmd) {
        String to = required(cmd, "to");
        byte[] media;
        try {
            media = Base64.getDecoder().decode(required(cmd, "media"));
        } catch (IllegalArgumentException e) {
            throw new ActionException(ErrorKind.BAD_REQUEST, "media is not valid base64");
        }
        String caption = cmd.text("caption");
        String jid = normalizeRecipient(to, cfg.recipientDomain);
        send(cmd, c -> c.sendMedia(jid, media, caption == null ? "" : caption));
    }

    private void send(WorkerCommand cmd, Function<ProtocolClient, CompletableFuture<SendReceipt>> op) {
        SessionMachine session = resident(cmd, ErrorKind.NOT_AVAILABLE);
        session.awaitConnected(cfg.connectWaitMs)
                .thenCompose(v -> attemptSend(session, op, 1))
                .whenComplete((receipt, err) -> {
                    if (err == null) {
                        reply(cmd, Envelopes.object().put("id", receipt.id()).put("delivered", true));
                    } else {
                        Throwable cause = unwrap(err);
                        ErrorKind kind = classifySendFailure(cause);
                        log.warn("[{}] send failed ({}): {}", cmd.sessionId(), kind.wireName, cause.getMessage());
                        fail(cmd, kind, cause.getMessage() != null ? cause.getMessage() : cause.toString());
                    }
                });
    }

    /**
     * One send attempt under its own deadline. Transport failures are retried after
     * {@code sendRetryDelayMs} up to {@code sendMaxAttempts}; recipient failures are final.
     */
    private CompletableFuture<SendReceipt> attemptSend(SessionMachine session,
                                                       Function<ProtocolClient, CompletableFuture<SendReceipt>> op,
                                                       int attempt) {
        ProtocolClient client = session.connectedClient();
        if (client == null) {
            return CompletableFuture.failedFuture(new ActionException(ErrorKind.NOT_CONNECTED, "session not connected"));
        }
        CompletableFuture<SendReceipt> call;
        try {
            call = op.apply(client);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<SendReceipt> result = new CompletableFuture<>();
        call.orTimeout(cfg.sendAttemptTimeoutMs, TimeUnit.MILLISECONDS).whenCompleteAsync((receipt, err) -> {
            if (err == null) {
                result.complete(receipt);
                return;
            }
            Throwable cause = unwrap(err);
            if (isTransport(cause) && attempt < cfg.sendMaxAttempts && !session.isTerminated()) {
                log.warn("[{}] send attempt {}/{} failed, retrying in {}ms: {}",
                        session.sessionId(), attempt, cfg.sendMaxAttempts, cfg.sendRetryDelayMs, cause.toString());
                loop.schedule(() -> attemptSend(session, op, attempt + 1).whenComplete((r, e) -> {
                    if (e == null) result.complete(r);
                    else result.completeExceptionally(unwrap(e));
                }), cfg.sendRetryDelayMs, TimeUnit.MILLISECONDS);
            } else {
                result.completeExceptionally(cause);
            }
        }, loop);
        return result;
    }

    private void disconnect(WorkerCommand cmd) {
        SessionMachine session = sessions.get(cmd.sessionId());
        if (session == null) {
            reply(cmd, Envelopes.object().put("ok", true));
            return;
        }
        log.info("[{}] disconnect requested", cmd.sessionId());
        session.disconnect().whenComplete((v, err) -> reply(cmd, Envelopes.object().put("ok", true)));
    }

    private void getStatus(WorkerCommand cmd) {
        reply(cmd, resident(cmd, ErrorKind.NOT_FOUND).snapshot().toJson());
    }

    // ---- Session exit ----

    private void onTerminated(SessionMachine session) {
        String id = session.sessionId();
        if (sessions.remove(id, session)) {
            persistence.forget(id);
            outbox.signal(WorkerSignal.release(index, generation, id));
            log.info("[{}] left worker {} ({})", id, index, session.status().wireName);
        }
    }

    // ---- Helpers ----

    private SessionMachine resident(WorkerCommand cmd, ErrorKind missingKind) {
        SessionMachine s = sessions.get(cmd.sessionId());
        if (s == null) throw new ActionException(missingKind, "session " + cmd.sessionId() + " not active");
        return s;
    }

    private void reply(WorkerCommand cmd, JsonNode data) {
        outbox.signal(WorkerSignal.reply(index, generation, cmd.requestId(), cmd.sessionId(), data));
    }

    private void fail(WorkerCommand cmd, ErrorKind kind, String error) {
        outbox.signal(WorkerSignal.failure(index, generation, cmd.requestId(), cmd.sessionId(), kind, error));
    }

    private static ObjectNode statusOnly(SessionMachine s) {
        return Envelopes.object().put("status", s.status().wireName);
    }

    private static String required(WorkerCommand cmd, String field) {
        String value = cmd.text(field);
        if (value == null || value.isEmpty()) throw new ActionException(ErrorKind.BAD_REQUEST, "missing " + field);
        return value;
    }

    /** Bare phone numbers get the default user domain; full ids pass through. */
    static String normalizeRecipient(String to, String domain) {
        return to.contains("@") ? to : to + "@" + domain;
    }

    static ErrorKind classifySendFailure(Throwable cause) {
        if (cause instanceof ActionException a) return a.kind;
        if (cause instanceof RecipientUnreachableException) return ErrorKind.RECIPIENT_UNREACHABLE;
        if (isTransport(cause)) return ErrorKind.TRANSPORT_TIMEOUT;
        return ErrorKind.INTERNAL;
    }

    private static boolean isTransport(Throwable cause) {
        return cause instanceof TimeoutException || cause instanceof IOException;
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}

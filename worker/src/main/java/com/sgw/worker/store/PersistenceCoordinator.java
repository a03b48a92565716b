package com.sgw.worker.store;

import com.sgw.protocol.SessionStatus;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Coalesces credential writes for the sessions of one worker.
 *
 * Soft updates apply to the in-memory blob immediately and (re)arm a debounce timer;
 * only the latest blob is written when it fires. Force updates cancel the timer and
 * write before returning. A failed write is retried once after a short delay.
 *
 * Confined to the owning worker's event loop: every method must be called on it.
 */
public final class PersistenceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PersistenceCoordinator.class);

    private final CredentialStore store;
    private final EventExecutor   loop;
    private final long            debounceMs;
    private final long            retryDelayMs;

    private final Map<String, Entry> entries = new HashMap<>();

    private static final class Entry {
        final String sessionId;
        byte[] blob;
        boolean loaded;
        String status = SessionStatus.INITIALIZING.wireName;
        ScheduledFuture<?> pending;

        Entry(String sessionId) { this.sessionId = sessionId; }
    }

    public PersistenceCoordinator(CredentialStore store, EventExecutor loop, long debounceMs, long retryDelayMs) {
        this.store        = store;
        this.loop         = loop;
        this.debounceMs   = debounceMs;
        this.retryDelayMs = retryDelayMs;
    }

    /**
     * @return the latest known blob: in-memory if any update happened since, else the stored one; null when unpaired
     */
    public byte[] load(String sessionId) throws CredentialStoreException {
        Entry e = entry(sessionId);
        if (!e.loaded) {
            Optional<CredentialRecord> stored = store.load(sessionId);
            if (e.blob == null && stored.isPresent()) e.blob = stored.get().blob();
            e.loaded = true;
            log.info("[{}] {}", sessionId, stored.isPresent() ? "credentials loaded" : "no stored credentials, fresh pairing");
        }
        return e.blob;
    }

    public void softUpdate(String sessionId, UnaryOperator<byte[]> mutateFn) {
        Entry e = entry(sessionId);
        e.blob = mutateFn.apply(e.blob);
        cancelPending(e);
        e.pending = loop.schedule(() -> {
            e.pending = null;
            write(e, null, 1);
        }, debounceMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Writes synchronously: the first attempt has completed when this returns. The future
     * completes once the write (or its single retry) succeeded, or exceptionally when both failed.
     */
    public CompletableFuture<Void> forceUpdate(String sessionId, UnaryOperator<byte[]> mutateFn) {
        Entry e = entry(sessionId);
        e.blob = mutateFn.apply(e.blob);
        cancelPending(e);
        CompletableFuture<Void> done = new CompletableFuture<>();
        write(e, done, 1);
        return done;
    }

    /** Diagnostic marker stored with the next write; does not trigger one. */
    public void markStatus(String sessionId, SessionStatus status) {
        entry(sessionId).status = status.wireName;
    }

    /** Writes a pending soft update now, if there is one. */
    public CompletableFuture<Void> flush(String sessionId) {
        Entry e = entries.get(sessionId);
        if (e == null || e.pending == null) return CompletableFuture.completedFuture(null);
        cancelPending(e);
        CompletableFuture<Void> done = new CompletableFuture<>();
        write(e, done, 1);
        return done;
    }

    /** Flushes and drops the in-memory state of a session leaving this worker. */
    public void forget(String sessionId) {
        flush(sessionId);
        entries.remove(sessionId);
    }

    public boolean hasPendingWrite(String sessionId) {
        Entry e = entries.get(sessionId);
        return e != null && e.pending != null;
    }

    private void write(Entry e, CompletableFuture<Void> done, int attempt) {
        if (e.blob == null) {
            if (done != null) done.complete(null);
            return;
        }
        try {
            store.upsert(new CredentialRecord(e.sessionId, e.status, Instant.now(), e.blob));
            log.debug("[{}] credentials saved", e.sessionId);
            if (done != null) done.complete(null);
        } catch (CredentialStoreException ex) {
            if (attempt == 1) {
                log.warn("[{}] credential write failed, retrying in {}ms: {}", e.sessionId, retryDelayMs, ex.getMessage());
                loop.schedule(() -> write(e, done, 2), retryDelayMs, TimeUnit.MILLISECONDS);
            } else {
                log.warn("[{}] credential write failed again, latest update not persisted", e.sessionId, ex);
                if (done != null) done.completeExceptionally(ex);
            }
        }
    }

    private void cancelPending(Entry e) {
        if (e.pending != null) {
            e.pending.cancel(false);
            e.pending = null;
        }
    }

    private Entry entry(String sessionId) {
        return entries.computeIfAbsent(sessionId, Entry::new);
    }
}

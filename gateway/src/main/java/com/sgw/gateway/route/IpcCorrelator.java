package com.sgw.gateway.route;

import com.sgw.common.LatencyStats;
import com.sgw.protocol.Action;
import com.sgw.protocol.ErrorKind;
import com.sgw.protocol.WorkerSignal;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * In-flight requests forwarded to workers, keyed by single-use request id.
 *
 * Every registered request ends exactly once: by its reply, by its timeout, or by being
 * failed (worker gone, send refused). The reply future always completes normally;
 * failures are delivered as {@code success=false} signals. Whatever arrives after the
 * entry is gone is dropped.
 *
 * Confined to the coordinator loop.
 */
public final class IpcCorrelator {

    private static final Logger log = LoggerFactory.getLogger(IpcCorrelator.class);

    public static final class PendingRequest {
        public final String requestId;
        public final String sessionId;
        public final Action action;
        public final int    workerIndex;
        public final CompletableFuture<WorkerSignal> reply;
        final long startNanos;
        ScheduledFuture<?> timeout;

        PendingRequest(String requestId, String sessionId, Action action, int workerIndex,
                       CompletableFuture<WorkerSignal> reply) {
            this.requestId   = requestId;
            this.sessionId   = sessionId;
            this.action      = action;
            this.workerIndex = workerIndex;
            this.reply       = reply;
            this.startNanos  = System.nanoTime();
        }
    }

    private final EventExecutor loop;
    private final long timeoutMs;
    private final LatencyStats latency;
    private final Map<String, PendingRequest> pending = new HashMap<>();

    public IpcCorrelator(EventExecutor loop, long timeoutMs, LatencyStats latency) {
        this.loop      = loop;
        this.timeoutMs = timeoutMs;
        this.latency   = latency;
    }

    public PendingRequest register(String sessionId, Action action, int workerIndex,
                                   CompletableFuture<WorkerSignal> reply) {
        String requestId = UUID.randomUUID().toString();
        PendingRequest p = new PendingRequest(requestId, sessionId, action, workerIndex, reply);
        pending.put(requestId, p);
        p.timeout = loop.schedule(() -> expire(requestId), timeoutMs, TimeUnit.MILLISECONDS);
        return p;
    }

    /** @return false when the reply matched nothing (late or unknown) */
    public boolean complete(WorkerSignal reply) {
        PendingRequest p = reply.requestId() == null ? null : pending.remove(reply.requestId());
        if (p == null) {
            log.debug("[{}] dropping unmatched reply {}", reply.sessionId(), reply.requestId());
            return false;
        }
        p.timeout.cancel(false);
        latency.record(System.nanoTime() - p.startNanos);
        p.reply.complete(reply);
        return true;
    }

    public boolean fail(String requestId, ErrorKind kind, String error) {
        PendingRequest p = pending.remove(requestId);
        if (p == null) return false;
        p.timeout.cancel(false);
        p.reply.complete(WorkerSignal.failure(p.workerIndex, 0L, requestId, p.sessionId, kind, error));
        return true;
    }

    /** Fails every request forwarded to {@code workerIndex}; it can no longer reply. */
    public int failAll(int workerIndex, ErrorKind kind, String error) {
        List<String> ids = new ArrayList<>();
        for (PendingRequest p : pending.values()) {
            if (p.workerIndex == workerIndex) ids.add(p.requestId);
        }
        ids.forEach(id -> fail(id, kind, error));
        return ids.size();
    }

    public int size() { return pending.size(); }

    private void expire(String requestId) {
        PendingRequest p = pending.remove(requestId);
        if (p == null) return;
        log.warn("[{}] {} timed out after {}ms on worker {}", p.sessionId, p.action.wireName, timeoutMs, p.workerIndex);
        p.reply.complete(WorkerSignal.failure(p.workerIndex, 0L, requestId, p.sessionId,
                ErrorKind.REQUEST_TIMEOUT, "worker did not reply within " + timeoutMs + "ms"));
    }
}

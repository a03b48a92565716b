package com.sgw.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.common.GatewayConfig;
import com.sgw.common.LatencyStats;
import com.sgw.gateway.pool.WorkerHandle;
import com.sgw.gateway.pool.WorkerLauncher;
import com.sgw.gateway.route.IpcCorrelator;
import com.sgw.gateway.route.OwnershipDirectory;
import com.sgw.protocol.Action;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.ErrorKind;
import com.sgw.protocol.WorkerCommand;
import com.sgw.protocol.WorkerSignal;
import io.netty.channel.DefaultEventLoop;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Supervisor of the worker pool and router of session actions.
 *
 * Single-threaded: the ownership directory, the pending-request table and the worker
 * slots are only touched on {@code loop}. HTTP threads and transports hop onto it.
 *
 * Worker exit handling, in one loop task:
 *   slot emptied -> ownership of that index released -> its pending requests failed
 *   -> replacement with the next generation scheduled after respawnDelayMs.
 * Signals from an older generation of an index are dropped.
 *
 * Sessions of a dead worker are reclaimed lazily: the next start_session routes by hash
 * and the new owner resumes from stored credentials.
 */
public final class Coordinator implements SessionRouter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final GatewayConfig cfg;
    private final WorkerLauncher launcher;
    private final DefaultEventLoop loop;
    private final LatencyStats ipcLatency = new LatencyStats("ipc-roundtrip");
    private final OwnershipDirectory directory;
    private final IpcCorrelator correlator;
    private final WorkerHandle[] slots;
    private final long[] generations;
    private final long startedAt = System.currentTimeMillis();

    private ScheduledFuture<?> metricsTask;
    private volatile boolean closed;

    public Coordinator(GatewayConfig cfg, WorkerLauncher launcher) {
        this.cfg         = cfg;
        this.launcher    = launcher;
        this.loop        = new DefaultEventLoop(new DefaultThreadFactory("coordinator"));
        this.directory   = new OwnershipDirectory(cfg.workers);
        this.correlator  = new IpcCorrelator(loop, cfg.ipcTimeoutMs, ipcLatency);
        this.slots       = new WorkerHandle[cfg.workers];
        this.generations = new long[cfg.workers];
    }

    /** Launches every worker; returns once all launches were attempted. */
    public void start() {
        loop.submit(() -> {
            for (int i = 0; i < cfg.workers; i++) launch(i);
            if (cfg.metricsIntervalSecs > 0) {
                metricsTask = loop.scheduleAtFixedRate(this::logMetrics,
                        cfg.metricsIntervalSecs, cfg.metricsIntervalSecs, TimeUnit.SECONDS);
            }
        }).syncUninterruptibly();
        log.info("Coordinator started with {} {} workers", cfg.workers, cfg.processMode() ? "process" : "embedded");
    }

    /** Issues start_session for each stored session, so a full restart resumes paired sessions. */
    public void restore(Collection<String> sessionIds) {
        log.info("Restoring {} stored sessions", sessionIds.size());
        for (String id : sessionIds) {
            forward(id, Action.START_SESSION, Envelopes.object()).thenAccept(reply -> {
                if (!reply.success()) log.warn("[{}] restore failed: {}", id, reply.error());
            });
        }
    }

    // ---- Routing ----

    @Override
    public CompletableFuture<WorkerSignal> forward(String sessionId, Action action, JsonNode payload) {
        CompletableFuture<WorkerSignal> result = new CompletableFuture<>();
        try {
            loop.execute(() -> dispatch(sessionId, action, payload, result));
        } catch (RejectedExecutionException e) {
            result.complete(WorkerSignal.failure(-1, 0L, null, sessionId, ErrorKind.NOT_AVAILABLE, "gateway shutting down"));
        }
        return result;
    }

    private void dispatch(String sessionId, Action action, JsonNode payload, CompletableFuture<WorkerSignal> result) {
        int index = directory.resolve(sessionId);
        WorkerHandle worker = slots[index];
        if (worker == null) {
            result.complete(WorkerSignal.failure(index, 0L, null, sessionId, ErrorKind.NOT_AVAILABLE,
                    "worker " + index + " unavailable"));
            return;
        }
        IpcCorrelator.PendingRequest p = correlator.register(sessionId, action, index, result);
        try {
            if (!worker.send(new WorkerCommand(action, p.requestId, sessionId, payload))) {
                correlator.fail(p.requestId, ErrorKind.NOT_AVAILABLE, "worker " + index + " unreachable");
            }
        } catch (IllegalArgumentException e) {
            log.warn("[{}] {} rejected by transport: {}", sessionId, action, e.getMessage());
            correlator.fail(p.requestId, ErrorKind.BAD_REQUEST, e.getMessage());
        }
    }

    /** Thread-safe entry for worker signals. */
    public void onSignal(WorkerSignal signal) {
        try {
            loop.execute(() -> handleSignal(signal));
        } catch (RejectedExecutionException e) {
            log.debug("Coordinator stopped, dropping {} from worker {}", signal.type(), signal.workerIndex());
        }
    }

    private void handleSignal(WorkerSignal signal) {
        int index = signal.workerIndex();
        WorkerHandle worker = index >= 0 && index < slots.length ? slots[index] : null;
        if (worker == null || worker.generation() != signal.generation()) {
            log.debug("Dropping stale {} from worker {} gen {}", signal.type(), index, signal.generation());
            return;
        }
        switch (signal.type()) {
            case REPLY   -> correlator.complete(signal);
            case CLAIM   -> directory.claim(signal.sessionId(), index);
            case RELEASE -> directory.release(signal.sessionId(), index);
        }
    }

    // ---- Supervision ----

    private void launch(int index) {
        if (closed) return;
        long generation = ++generations[index];
        WorkerHandle worker;
        try {
            worker = launcher.launch(index, generation, this::onSignal);
        } catch (Exception e) {
            log.error("Failed to launch worker {} (gen {}), retrying in {}ms", index, generation, cfg.respawnDelayMs, e);
            loop.schedule(() -> launch(index), cfg.respawnDelayMs, TimeUnit.MILLISECONDS);
            return;
        }
        slots[index] = worker;
        worker.exitFuture().whenComplete((v, err) -> {
            try {
                loop.execute(() -> onWorkerExit(index, generation));
            } catch (RejectedExecutionException e) {
                log.debug("Coordinator stopped, worker {} exit not handled", index);
            }
        });
    }

    private void onWorkerExit(int index, long generation) {
        WorkerHandle worker = slots[index];
        if (worker == null || worker.generation() != generation) return;
        slots[index] = null;
        int released = directory.releaseAll(index);
        int failed   = correlator.failAll(index, ErrorKind.NOT_AVAILABLE, "worker " + index + " exited");
        if (closed) return;
        log.warn("Worker {} (gen {}) exited: released {} sessions, failed {} pending requests; respawning in {}ms",
                index, generation, released, failed, cfg.respawnDelayMs);
        loop.schedule(() -> launch(index), cfg.respawnDelayMs, TimeUnit.MILLISECONDS);
    }

    /** Abruptly stops a worker, as a crash would. */
    public void killWorker(int index) {
        loop.execute(() -> {
            WorkerHandle worker = slots[index];
            if (worker != null) worker.kill();
        });
    }

    // ---- Queries ----

    @Override
    public CompletableFuture<ObjectNode> health() {
        return onLoop(() -> {
            int alive = 0;
            for (WorkerHandle w : slots) if (w != null) alive++;
            return Envelopes.object()
                    .put("workerCount", cfg.workers)
                    .put("workersAlive", alive)
                    .put("uptimeSeconds", (System.currentTimeMillis() - startedAt) / 1000)
                    .put("claimedSessions", directory.size())
                    .put("pendingRequests", correlator.size());
        });
    }

    /** @return the claimed owner of the session, or -1 */
    public CompletableFuture<Integer> ownerOf(String sessionId) {
        return onLoop(() -> directory.owner(sessionId));
    }

    /** @return generation of the live incarnation at {@code index}, or 0 while the slot is empty */
    public CompletableFuture<Long> generationOf(int index) {
        return onLoop(() -> slots[index] == null ? 0L : slots[index].generation());
    }

    private <T> CompletableFuture<T> onLoop(Supplier<T> query) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            loop.execute(() -> result.complete(query.get()));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    private void logMetrics() {
        Runtime rt = Runtime.getRuntime();
        long usedMb = (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024);
        String latency = ipcLatency.summarizeAndReset();
        log.info("Coordinator: claimed={} pending={} heapUsed={}MB {}",
                directory.size(), correlator.size(), usedMb, latency != null ? latency : "ipc-roundtrip idle");
    }

    // ---- Shutdown ----

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        List<CompletableFuture<Void>> exits = new ArrayList<>();
        loop.submit(() -> {
            if (metricsTask != null) metricsTask.cancel(false);
            for (WorkerHandle w : slots) {
                if (w == null) continue;
                exits.add(w.exitFuture());
                w.stop();
            }
        }).syncUninterruptibly();
        try {
            CompletableFuture.allOf(exits.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Not every worker stopped in time: {}", e.toString());
        }
        loop.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        log.info("Coordinator stopped.");
    }
}

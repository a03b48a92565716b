package com.sgw.gateway.pool;

import com.sgw.common.GatewayConfig;
import com.sgw.protocol.WorkerCommand;
import com.sgw.protocol.WorkerSignal;
import com.sgw.worker.Worker;
import com.sgw.worker.client.ProtocolClientFactory;
import com.sgw.worker.notify.Notifier;
import com.sgw.worker.store.CredentialStore;
import io.netty.channel.DefaultEventLoop;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Embedded mode: every worker is an in-JVM {@link Worker} on its own single-threaded
 * event loop. Commands and signals are passed as objects. The worker's exit is the
 * termination of its loop.
 */
public final class LocalWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerLauncher.class);

    private final GatewayConfig cfg;
    private final ProtocolClientFactory clients;
    private final CredentialStore store;
    private final Notifier notifier;

    public LocalWorkerLauncher(GatewayConfig cfg, ProtocolClientFactory clients,
                               CredentialStore store, Notifier notifier) {
        this.cfg      = cfg;
        this.clients  = clients;
        this.store    = store;
        this.notifier = notifier;
    }

    @Override
    public WorkerHandle launch(int index, long generation, Consumer<WorkerSignal> signals) {
        DefaultEventLoop loop = new DefaultEventLoop(new DefaultThreadFactory("worker-" + index + "-g" + generation));
        Worker worker = new Worker(index, generation, cfg, loop, clients, store, notifier, signals::accept);
        log.info("Launched embedded worker {} (gen {})", index, generation);
        return new LocalWorkerHandle(worker, loop);
    }

    @Override
    public void close() {
        // workers are stopped through their handles
    }

    public static final class LocalWorkerHandle implements WorkerHandle {

        private final Worker worker;
        private final DefaultEventLoop loop;
        private final CompletableFuture<Void> exit = new CompletableFuture<>();

        LocalWorkerHandle(Worker worker, DefaultEventLoop loop) {
            this.worker = worker;
            this.loop   = loop;
            loop.terminationFuture().addListener(f -> exit.complete(null));
        }

        @Override
        public int index() { return worker.index(); }

        @Override
        public long generation() { return worker.generation(); }

        @Override
        public boolean send(WorkerCommand command) {
            if (loop.isShuttingDown()) return false;
            worker.submit(command);
            return true;
        }

        @Override
        public CompletableFuture<Void> exitFuture() { return exit; }

        @Override
        public void stop() {
            worker.shutdown().whenComplete((v, err) -> loop.shutdownGracefully(0, 1, TimeUnit.SECONDS));
        }

        /**
         * Protocol handles are closed, as the OS would on a crash. No flush, logout or release
         * signal; scheduled timers die with the loop.
         */
        @Override
        public void kill() {
            log.warn("Killing embedded worker {} (gen {})", worker.index(), worker.generation());
            worker.abort();
            loop.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
        }
    }
}

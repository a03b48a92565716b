package com.sgw.worker;

import com.sgw.common.GatewayConfig;
import com.sgw.worker.aeron.AeronCommandSubscriber;
import com.sgw.worker.aeron.AeronSignalPublisher;
import com.sgw.worker.client.ProtocolClientFactory;
import com.sgw.worker.client.ProtocolClients;
import com.sgw.worker.notify.WebhookNotifier;
import com.sgw.worker.store.CredentialStore;
import com.sgw.worker.store.CredentialStores;
import io.aeron.Aeron;
import io.netty.channel.DefaultEventLoop;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Entry point for a worker process (process mode).
 *
 * Usage:
 *   java -cp ... com.sgw.worker.WorkerMain [config-path | -] index generation
 *
 * Connects to the coordinator's embedded MediaDriver, serves commands from stream
 * (commandStreamBase + index) and answers on (signalStreamBase + index).
 * Exits on SIGINT/SIGTERM or when the parent coordinator process goes away.
 */
public final class WorkerMain {

    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            System.err.println("usage: WorkerMain <config-path|-> <index> <generation>");
            System.exit(2);
        }
        String configPath = "-".equals(args[0]) ? null : args[0];
        int    index      = Integer.parseInt(args[1]);
        long   generation = Long.parseLong(args[2]);
        GatewayConfig cfg = GatewayConfig.load(configPath);

        log.info("Starting worker {} (gen {}): client={} store={}", index, generation,
                cfg.protocolClient, cfg.credentialStore);

        ProtocolClientFactory clients = ProtocolClients.load(cfg.protocolClient);
        CredentialStore store = CredentialStores.fromConfig(cfg);

        DefaultEventLoop loop = new DefaultEventLoop(new DefaultThreadFactory("worker-" + index));
        NioEventLoopGroup io  = new NioEventLoopGroup(1, new DefaultThreadFactory("worker-" + index + "-io"));
        ShutdownSignalBarrier barrier = new ShutdownSignalBarrier();

        ProcessHandle.current().parent().ifPresent(parent -> parent.onExit().thenRun(() -> {
            log.warn("Worker {}: coordinator process {} exited, shutting down", index, parent.pid());
            barrier.signal();
        }));

        try (Aeron aeron = Aeron.connect(new Aeron.Context().aeronDirectoryName(cfg.aeronDir));
             AeronSignalPublisher publisher = new AeronSignalPublisher(cfg, aeron, index)) {

            if (!publisher.awaitConnected(5_000)) {
                log.warn("Worker {}: coordinator not subscribed yet, continuing", index);
            }

            WebhookNotifier notifier = new WebhookNotifier(cfg, io);
            Worker worker = new Worker(index, generation, cfg, loop, clients, store, notifier, publisher);
            AeronCommandSubscriber subscriber = new AeronCommandSubscriber(cfg, aeron, worker);
            subscriber.start();

            log.info("Worker {} is UP.", index);
            barrier.await();

            subscriber.stop();
            worker.shutdown().get(5, TimeUnit.SECONDS);
            log.info("Worker {} shutdown complete.", index);
        } finally {
            loop.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            io.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }
}

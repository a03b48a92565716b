package com.sgw.gateway;

import com.sgw.common.GatewayConfig;
import com.sgw.gateway.pool.LocalWorkerLauncher;
import com.sgw.gateway.pool.ProcessWorkerLauncher;
import com.sgw.gateway.pool.WorkerLauncher;
import com.sgw.worker.client.ProtocolClients;
import com.sgw.worker.notify.WebhookNotifier;
import com.sgw.worker.store.CredentialStore;
import com.sgw.worker.store.CredentialStores;
import io.aeron.Aeron;
import io.aeron.driver.MediaDriver;
import io.aeron.driver.ThreadingMode;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway process entry point.
 *
 * Usage:
 *   java -jar gateway.jar [config-path]
 *
 * The jar manifest opens java.base/sun.nio.ch for the Aeron driver; when launching from a
 * plain classpath, pass --add-opens java.base/sun.nio.ch=ALL-UNNAMED yourself.
 *
 * workerMode=embedded (default dev config) runs every worker in this JVM.
 * workerMode=process starts an embedded Aeron MediaDriver and one child JVM per worker.
 */
public final class GatewayMain {

    private static final Logger log = LoggerFactory.getLogger(GatewayMain.class);

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        GatewayConfig cfg = GatewayConfig.load(configPath);

        log.info("Starting session gateway: port={} workers={} mode={}", cfg.httpPort, cfg.workers, cfg.workerMode);

        CredentialStore store = CredentialStores.fromConfig(cfg);

        if (cfg.processMode()) {
            // Embedded driver shared with the worker processes
            MediaDriver.Context driverCtx = new MediaDriver.Context()
                    .aeronDirectoryName(cfg.aeronDir)
                    .threadingMode(ThreadingMode.SHARED)
                    .dirDeleteOnStart(true)
                    .dirDeleteOnShutdown(true);

            try (MediaDriver driver = MediaDriver.launch(driverCtx);
                 Aeron aeron = Aeron.connect(new Aeron.Context().aeronDirectoryName(cfg.aeronDir));
                 ProcessWorkerLauncher launcher = new ProcessWorkerLauncher(cfg, configPath, aeron)) {
                run(cfg, launcher, store);
            }
        } else {
            NioEventLoopGroup webhookGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("webhook"));
            try (LocalWorkerLauncher launcher = new LocalWorkerLauncher(cfg,
                    ProtocolClients.load(cfg.protocolClient), store, new WebhookNotifier(cfg, webhookGroup))) {
                run(cfg, launcher, store);
            } finally {
                webhookGroup.shutdownGracefully();
            }
        }
    }

    private static void run(GatewayConfig cfg, WorkerLauncher launcher, CredentialStore store) throws Exception {
        try (Coordinator coordinator = new Coordinator(cfg, launcher)) {
            coordinator.start();
            if (cfg.restoreOnStartup) {
                coordinator.restore(store.sessionIds());
            }

            HttpGatewayServer server = new HttpGatewayServer(cfg, coordinator);
            server.start();

            log.info("Session gateway is UP. Ctrl-C to stop.");
            new ShutdownSignalBarrier().await();

            server.stop();
        }
    }
}

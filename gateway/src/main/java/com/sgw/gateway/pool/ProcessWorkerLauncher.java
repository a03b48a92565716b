package com.sgw.gateway.pool;

import com.sgw.common.GatewayConfig;
import com.sgw.gateway.aeron.AeronCommandPublisher;
import com.sgw.gateway.aeron.AeronSignalSubscriber;
import com.sgw.protocol.WorkerCommand;
import com.sgw.protocol.WorkerSignal;
import com.sgw.worker.WorkerMain;
import io.aeron.Aeron;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Process mode: every worker is a child JVM running {@link WorkerMain} on this JVM's
 * classpath, talking to the coordinator over the embedded MediaDriver.
 *
 *   coordinator --commandStreamBase+i--> worker i
 *   worker i    --signalStreamBase+i---> coordinator
 *
 * Worker death is observed through {@link Process#onExit()}.
 */
public final class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    // Aeron's client needs this on JDK 17 just as the driver does
    static final String ADD_OPENS = "--add-opens=java.base/sun.nio.ch=ALL-UNNAMED";

    private final String configPath;
    private final AeronCommandPublisher commands;
    private final AeronSignalSubscriber signalSubscriber;
    private volatile Consumer<WorkerSignal> sink;

    public ProcessWorkerLauncher(GatewayConfig cfg, String configPath, Aeron aeron) {
        this.configPath       = configPath;
        this.commands         = new AeronCommandPublisher(cfg, aeron);
        this.signalSubscriber = new AeronSignalSubscriber(cfg, aeron, signal -> {
            Consumer<WorkerSignal> s = sink;
            if (s != null) s.accept(signal);
        });
        signalSubscriber.start();
    }

    @Override
    public WorkerHandle launch(int index, long generation, Consumer<WorkerSignal> signals) throws IOException {
        sink = signals;
        List<String> command = List.of(
                javaBinary(),
                ADD_OPENS,
                "-cp", System.getProperty("java.class.path"),
                WorkerMain.class.getName(),
                configPath != null ? configPath : "-",
                Integer.toString(index),
                Long.toString(generation));
        Process process = new ProcessBuilder(command)
                .inheritIO()
                .start();
        log.info("Launched worker process {} (gen {}) pid={}", index, generation, process.pid());
        return new ProcessWorkerHandle(index, generation, process, commands);
    }

    @Override
    public void close() {
        signalSubscriber.stop();
        commands.close();
    }

    private static String javaBinary() {
        return ProcessHandle.current().info().command()
                .orElse(System.getProperty("java.home") + File.separator + "bin" + File.separator + "java");
    }

    static final class ProcessWorkerHandle implements WorkerHandle {

        private final int index;
        private final long generation;
        private final Process process;
        private final AeronCommandPublisher commands;
        private final CompletableFuture<Void> exit;

        ProcessWorkerHandle(int index, long generation, Process process, AeronCommandPublisher commands) {
            this.index      = index;
            this.generation = generation;
            this.process    = process;
            this.commands   = commands;
            this.exit       = process.onExit().thenApply(p -> {
                log.warn("Worker process {} (gen {}) exited with code {}", index, generation, p.exitValue());
                return null;
            });
        }

        @Override
        public int index() { return index; }

        @Override
        public long generation() { return generation; }

        @Override
        public boolean send(WorkerCommand command) {
            return process.isAlive() && commands.publish(index, command);
        }

        @Override
        public CompletableFuture<Void> exitFuture() { return exit; }

        @Override
        public void stop() { process.destroy(); }

        @Override
        public void kill() { process.destroyForcibly(); }
    }
}

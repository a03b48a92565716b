package com.sgw.worker.aeron;

import com.sgw.common.GatewayConfig;
import com.sgw.common.SessionPartitioner;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.WorkerCommand;
import com.sgw.worker.Worker;
import io.aeron.Aeron;
import io.aeron.FragmentAssembler;
import io.aeron.Subscription;
import io.aeron.logbuffer.FragmentHandler;
import io.aeron.logbuffer.Header;
import org.agrona.DirectBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the worker's command stream ({@code commandStreamBase + index}) and hands each
 * command to the worker loop. Runs on a dedicated thread; never touches session state.
 */
public final class AeronCommandSubscriber implements Runnable, FragmentHandler {

    private static final Logger log = LoggerFactory.getLogger(AeronCommandSubscriber.class);

    private final Worker worker;
    private final Subscription sub;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private Thread thread;

    public AeronCommandSubscriber(GatewayConfig cfg, Aeron aeron, Worker worker) {
        this.worker = worker;
        int stream = SessionPartitioner.commandStream(worker.index(), cfg);
        this.sub = aeron.addSubscription(cfg.aeronChannel, stream);
        log.info("Worker {} subscribed to commands on stream {}", worker.index(), stream);
    }

    public void start() {
        thread = new Thread(this, "worker-" + worker.index() + "-commands");
        thread.setDaemon(true);
        thread.start();
    }

    public void stop() throws InterruptedException {
        running.set(false);
        if (thread != null) thread.join(1_000);
    }

    @Override
    public void run() {
        FragmentAssembler assembler = new FragmentAssembler(this);
        while (running.get()) {
            int fragments = sub.poll(assembler, 64);
            if (fragments == 0) {
                Thread.yield();
            }
        }
        sub.close();
    }

    @Override
    public void onFragment(DirectBuffer buffer, int offset, int length, Header header) {
        if (length < 1) return;
        WorkerCommand cmd;
        try {
            cmd = Envelopes.decodeCommand(buffer, offset, length);
        } catch (UncheckedIOException e) {
            log.warn("Worker {}: undecodable command ({} bytes): {}", worker.index(), length, e.getMessage());
            return;
        }
        worker.submit(cmd);
    }
}

package com.sgw.gateway.aeron;

import com.sgw.common.GatewayConfig;
import com.sgw.common.SessionPartitioner;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.WorkerSignal;
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
import java.util.function.Consumer;

/**
 * Subscribes to every worker signal stream and hands decoded signals to the sink.
 * Runs on a dedicated daemon thread; the sink must hop to its own thread.
 */
public final class AeronSignalSubscriber implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AeronSignalSubscriber.class);

    private final GatewayConfig cfg;
    private final Subscription[] subs;
    private final Consumer<WorkerSignal> sink;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public AeronSignalSubscriber(GatewayConfig cfg, Aeron aeron, Consumer<WorkerSignal> sink) {
        this.cfg  = cfg;
        this.sink = sink;
        // subscribe before any worker is spawned so early claims are not lost
        this.subs = new Subscription[cfg.workers];
        for (int i = 0; i < cfg.workers; i++) {
            subs[i] = aeron.addSubscription(cfg.aeronChannel, SessionPartitioner.signalStream(i, cfg));
        }
    }

    public void start() {
        Thread t = new Thread(this, "gateway-signal-subscriber");
        t.setDaemon(true);
        t.start();
        log.info("AeronSignalSubscriber started, polling {} worker streams", cfg.workers);
    }

    public void stop() { running.set(false); }

    @Override
    public void run() {
        // signals larger than one frame arrive fragmented
        FragmentHandler handler = new FragmentAssembler(this::onFragment);

        while (running.get()) {
            int fragments = 0;
            for (Subscription sub : subs) {
                fragments += sub.poll(handler, 64);
            }
            if (fragments == 0) Thread.yield();
        }

        for (Subscription s : subs) s.close();
    }

    private void onFragment(DirectBuffer buffer, int offset, int length, Header header) {
        if (length < 1) return;
        WorkerSignal signal;
        try {
            signal = Envelopes.decodeSignal(buffer, offset, length);
        } catch (UncheckedIOException e) {
            log.warn("Undecodable worker signal on stream {}: {}", header.streamId(), e.getMessage());
            return;
        }
        sink.accept(signal);
    }
}

package com.sgw.worker.aeron;

import com.sgw.common.GatewayConfig;
import com.sgw.common.SessionPartitioner;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.ErrorKind;
import com.sgw.protocol.WorkerSignal;
import com.sgw.worker.WorkerOutbox;
import io.aeron.Aeron;
import io.aeron.Publication;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Publishes a worker's signals (replies, claims, releases) on stream
 * {@code signalStreamBase + index}. One JSON envelope per Aeron message.
 */
public final class AeronSignalPublisher implements WorkerOutbox, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AeronSignalPublisher.class);

    private static final int OFFER_ATTEMPTS = 5;

    private final int workerIndex;
    private final Publication pub;

    public AeronSignalPublisher(GatewayConfig cfg, Aeron aeron, int workerIndex) {
        this.workerIndex = workerIndex;
        int stream = SessionPartitioner.signalStream(workerIndex, cfg);
        this.pub = aeron.addPublication(cfg.aeronChannel, stream);
        log.info("Worker {} publishing signals on stream {}", workerIndex, stream);
    }

    /** Blocks until the coordinator's subscription is attached, at most {@code timeoutMs}. */
    public boolean awaitConnected(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (!pub.isConnected()) {
            if (System.nanoTime() > deadline) return false;
            Thread.sleep(10);
        }
        return true;
    }

    @Override
    public synchronized void signal(WorkerSignal signal) {
        byte[] bytes = Envelopes.encode(signal);
        if (bytes.length > pub.maxMessageLength()) {
            log.warn("Worker {}: {} for [{}] is {} bytes, over the transport limit of {}",
                    workerIndex, signal.type(), signal.sessionId(), bytes.length, pub.maxMessageLength());
            if (signal.type() != WorkerSignal.Type.REPLY) return;
            // the caller still gets an answer instead of waiting out its timeout
            signal = WorkerSignal.failure(signal.workerIndex(), signal.generation(), signal.requestId(),
                    signal.sessionId(), ErrorKind.INTERNAL, "reply exceeds transport limit");
            bytes = Envelopes.encode(signal);
        }
        UnsafeBuffer buf = new UnsafeBuffer(bytes);
        long result;
        int attempts = 0;
        do {
            result = pub.offer(buf, 0, bytes.length);
            if (result > 0) return;
            attempts++;
            Thread.yield();
        } while ((result == Publication.BACK_PRESSURED || result == Publication.ADMIN_ACTION) && attempts < OFFER_ATTEMPTS);
        log.warn("Worker {} failed to publish {} for [{}]: {}", workerIndex, signal.type(), signal.sessionId(), result);
    }

    @Override
    public void close() {
        pub.close();
    }
}

package com.sgw.gateway.aeron;

import com.sgw.common.GatewayConfig;
import com.sgw.common.SessionPartitioner;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.WorkerCommand;
import io.aeron.Aeron;
import io.aeron.Publication;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One Publication per worker index on stream {@code commandStreamBase + index}.
 * Publications outlive worker incarnations: a respawned worker subscribes to the same stream.
 */
public final class AeronCommandPublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AeronCommandPublisher.class);

    private final GatewayConfig cfg;
    private final Aeron aeron;
    private final Publication[] pubs;

    public AeronCommandPublisher(GatewayConfig cfg, Aeron aeron) {
        this.cfg   = cfg;
        this.aeron = aeron;
        this.pubs  = new Publication[cfg.workers];
    }

    /**
     * @return false when the command could not be offered right now
     * @throws IllegalArgumentException when the encoded command exceeds the publication's
     *         maximum message length; retrying cannot help
     */
    public boolean publish(int workerIndex, WorkerCommand command) {
        Publication pub = getOrCreatePub(workerIndex);
        byte[] bytes = Envelopes.encode(command);
        if (bytes.length > pub.maxMessageLength()) {
            throw new IllegalArgumentException("command of " + bytes.length
                    + " bytes exceeds the transport limit of " + pub.maxMessageLength());
        }
        long result = pub.offer(new UnsafeBuffer(bytes), 0, bytes.length);
        if (result > 0) return true;
        if (result == Publication.BACK_PRESSURED || result == Publication.ADMIN_ACTION) {
            log.warn("Aeron back-pressure on worker {} command stream: {}", workerIndex, result);
            return false;
        }
        log.warn("Aeron offer to worker {} failed: {}", workerIndex, result);
        return false;
    }

    private synchronized Publication getOrCreatePub(int workerIndex) {
        if (pubs[workerIndex] == null) {
            int stream = SessionPartitioner.commandStream(workerIndex, cfg);
            pubs[workerIndex] = aeron.addPublication(cfg.aeronChannel, stream);
            log.info("Created command publication for worker {} stream {}", workerIndex, stream);
        }
        return pubs[workerIndex];
    }

    @Override
    public synchronized void close() {
        for (Publication p : pubs) {
            if (p != null) p.close();
        }
    }
}

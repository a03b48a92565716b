package com.sgw.worker.session;

import com.sgw.worker.client.ProtocolEvent;
import com.sgw.worker.client.ProtocolEventSink;
import io.netty.util.concurrent.EventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Bounded hand-off from one protocol handle's threads to the worker event loop.
 *
 * Events are drained in order by a single task on the loop. Inbound messages beyond
 * the capacity are dropped; lifecycle and credential events are always queued.
 * Once closed (handle torn down) everything still queued or emitted later is discarded.
 */
final class SessionEventChannel implements ProtocolEventSink {

    private static final Logger log = LoggerFactory.getLogger(SessionEventChannel.class);

    private final String sessionId;
    private final EventExecutor loop;
    private final int messageCapacity;
    private final Consumer<ProtocolEvent> consumer;

    // guarded by this
    private final ArrayDeque<ProtocolEvent> queue = new ArrayDeque<>();
    private int queuedMessages;
    private boolean drainScheduled;
    private boolean closed;

    SessionEventChannel(String sessionId, EventExecutor loop, int messageCapacity, Consumer<ProtocolEvent> consumer) {
        this.sessionId       = sessionId;
        this.loop            = loop;
        this.messageCapacity = messageCapacity;
        this.consumer        = consumer;
    }

    @Override
    public void emit(ProtocolEvent event) {
        synchronized (this) {
            if (closed) return;
            boolean message = event instanceof ProtocolEvent.MessageReceived;
            if (message && queuedMessages >= messageCapacity) {
                log.warn("[{}] event queue full, dropping inbound message", sessionId);
                return;
            }
            queue.add(event);
            if (message) queuedMessages++;
            if (drainScheduled) return;
            drainScheduled = true;
        }
        try {
            loop.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] worker loop stopped, discarding events", sessionId);
            close();
        }
    }

    void close() {
        synchronized (this) {
            closed = true;
            queue.clear();
            queuedMessages = 0;
        }
    }

    private void drain() {
        for (;;) {
            ProtocolEvent event;
            synchronized (this) {
                event = closed ? null : queue.poll();
                if (event == null) {
                    drainScheduled = false;
                    return;
                }
                if (event instanceof ProtocolEvent.MessageReceived) queuedMessages--;
            }
            consumer.accept(event);
        }
    }
}

package com.sgw.gateway.route;

import com.sgw.common.LatencyStats;
import com.sgw.protocol.Action;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.ErrorKind;
import com.sgw.protocol.WorkerSignal;
import io.netty.channel.DefaultEventLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IpcCorrelatorTest {

    private final DefaultEventLoop loop = new DefaultEventLoop();
    private final LatencyStats latency = new LatencyStats("test");

    @AfterEach
    void tearDown() {
        loop.shutdownGracefully(0, 100, TimeUnit.MILLISECONDS).syncUninterruptibly();
    }

    private <T> T onLoop(Callable<T> task) throws Exception {
        return loop.submit(task).get(2, TimeUnit.SECONDS);
    }

    @Test
    void replyCompletesMatchingRequestOnce() throws Exception {
        IpcCorrelator correlator = new IpcCorrelator(loop, 5_000, latency);
        CompletableFuture<WorkerSignal> reply = new CompletableFuture<>();
        IpcCorrelator.PendingRequest p = onLoop(() -> correlator.register("s1", Action.GET_STATUS, 0, reply));

        WorkerSignal signal = WorkerSignal.reply(0, 1L, p.requestId, "s1", Envelopes.object().put("status", "connected"));
        assertTrue(onLoop(() -> correlator.complete(signal)));
        assertSame(signal, reply.getNow(null));
        assertTrue(latency.summarizeAndReset().contains("count=1"));

        assertFalse(onLoop(() -> correlator.complete(signal)), "late duplicate is dropped");
        assertEquals(0, (int) onLoop(correlator::size));
    }

    @Test
    void requestIdsAreUnique() throws Exception {
        IpcCorrelator correlator = new IpcCorrelator(loop, 5_000, latency);
        IpcCorrelator.PendingRequest a = onLoop(() -> correlator.register("s", Action.SEND_TEXT, 0, new CompletableFuture<>()));
        IpcCorrelator.PendingRequest b = onLoop(() -> correlator.register("s", Action.SEND_TEXT, 0, new CompletableFuture<>()));
        assertNotEquals(a.requestId, b.requestId);
        assertEquals(2, (int) onLoop(correlator::size));
    }

    @Test
    void unansweredRequestTimesOut() throws Exception {
        IpcCorrelator correlator = new IpcCorrelator(loop, 50, latency);
        CompletableFuture<WorkerSignal> reply = new CompletableFuture<>();
        IpcCorrelator.PendingRequest p = onLoop(() -> correlator.register("s1", Action.SEND_TEXT, 1, reply));

        WorkerSignal failure = reply.get(1, TimeUnit.SECONDS);
        assertFalse(failure.success());
        assertEquals(ErrorKind.REQUEST_TIMEOUT, failure.errorKind());
        assertEquals(p.requestId, failure.requestId());

        WorkerSignal late = WorkerSignal.reply(1, 1L, p.requestId, "s1", Envelopes.object());
        assertFalse(onLoop(() -> correlator.complete(late)));
    }

    @Test
    void failAllTargetsOneWorker() throws Exception {
        IpcCorrelator correlator = new IpcCorrelator(loop, 5_000, latency);
        CompletableFuture<WorkerSignal> onDead  = new CompletableFuture<>();
        CompletableFuture<WorkerSignal> onAlive = new CompletableFuture<>();
        onLoop(() -> correlator.register("a", Action.SEND_TEXT, 0, onDead));
        onLoop(() -> correlator.register("b", Action.SEND_TEXT, 1, onAlive));

        assertEquals(1, (int) onLoop(() -> correlator.failAll(0, ErrorKind.NOT_AVAILABLE, "worker 0 exited")));
        assertEquals(ErrorKind.NOT_AVAILABLE, onDead.getNow(null).errorKind());
        assertFalse(onAlive.isDone());
        assertEquals(1, (int) onLoop(correlator::size));
    }

    @Test
    void unknownRequestCannotBeFailed() throws Exception {
        IpcCorrelator correlator = new IpcCorrelator(loop, 5_000, latency);
        assertFalse(onLoop(() -> correlator.fail("nope", ErrorKind.INTERNAL, "x")));
    }
}

package com.sgw.gateway;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.common.GatewayConfig;
import com.sgw.common.SessionPartitioner;
import com.sgw.gateway.pool.LocalWorkerLauncher;
import com.sgw.gateway.route.OwnershipDirectory;
import com.sgw.protocol.Action;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.ErrorKind;
import com.sgw.protocol.WorkerSignal;
import com.sgw.worker.notify.Notifier;
import com.sgw.worker.store.InMemoryCredentialStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorTest {

    private static final Notifier SILENT = (sessionId, event, data) -> {};

    private GatewayConfig cfg;
    private InstantClients clients;
    private Coordinator coordinator;

    @BeforeEach
    void setUp() {
        cfg = new GatewayConfig();
        cfg.workers             = 2;
        cfg.respawnDelayMs      = 50;
        cfg.ipcTimeoutMs        = 3_000;
        cfg.metricsIntervalSecs = 0;
        cfg.connectWaitMs       = 5_000;
        cfg.stableDwellMs       = 50;
        cfg.credentialStore     = "memory";
        clients = new InstantClients();
        coordinator = new Coordinator(cfg, new LocalWorkerLauncher(cfg, clients, new InMemoryCredentialStore(), SILENT));
        coordinator.start();
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private WorkerSignal call(String sessionId, Action action, ObjectNode payload) throws Exception {
        return coordinator.forward(sessionId, action, payload).get(4, TimeUnit.SECONDS);
    }

    private static void waitFor(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(5);
        }
    }

    private int owner(String sessionId) {
        return coordinator.ownerOf(sessionId).join();
    }

    @Test
    void startClaimsOnHashedWorker() throws Exception {
        WorkerSignal reply = call("alice", Action.START_SESSION, Envelopes.object());

        assertTrue(reply.success());
        int expected = SessionPartitioner.partition("alice", 2);
        assertEquals(expected, reply.workerIndex());
        assertEquals(expected, owner("alice"));
    }

    @Test
    void repeatedStartsKeepOneHandle() throws Exception {
        List<CompletableFuture<WorkerSignal>> starts = List.of(
                coordinator.forward("bob", Action.START_SESSION, Envelopes.object()),
                coordinator.forward("bob", Action.START_SESSION, Envelopes.object()),
                coordinator.forward("bob", Action.START_SESSION, Envelopes.object()));
        for (CompletableFuture<WorkerSignal> f : starts) {
            assertTrue(f.get(4, TimeUnit.SECONDS).success());
        }
        assertEquals(1, clients.created.stream().filter("bob"::equals).count());
    }

    @Test
    void sendAndStatusReachTheOwner() throws Exception {
        call("carol", Action.START_SESSION, Envelopes.object());

        WorkerSignal sent = call("carol", Action.SEND_TEXT, Envelopes.object().put("to", "123").put("text", "hi"));
        assertTrue(sent.success(), String.valueOf(sent.error()));
        assertTrue(sent.data().get("delivered").asBoolean());

        WorkerSignal status = call("carol", Action.GET_STATUS, null);
        assertEquals("connected", status.data().get("status").asText());
    }

    @Test
    void unknownSessionStatusIsNotFound() throws Exception {
        assertEquals(ErrorKind.NOT_FOUND, call("nobody", Action.GET_STATUS, null).errorKind());
    }

    @Test
    void disconnectReleasesOwnership() throws Exception {
        call("dave", Action.START_SESSION, Envelopes.object());
        assertTrue(call("dave", Action.DISCONNECT, null).success());
        waitFor("release", () -> owner("dave") == OwnershipDirectory.UNCLAIMED);
    }

    @Test
    void workerCrashFailsPendingAndReleasesOwnership() throws Exception {
        call("pending-1", Action.START_SESSION, Envelopes.object());
        int index = owner("pending-1");
        assertNotEquals(OwnershipDirectory.UNCLAIMED, index);

        CompletableFuture<WorkerSignal> send = coordinator.forward("pending-1", Action.SEND_TEXT,
                Envelopes.object().put("to", "123").put("text", "hi"));
        waitFor("send in flight", () -> coordinator.health().join().get("pendingRequests").asInt() == 1);

        coordinator.killWorker(index);

        WorkerSignal failed = send.get(2, TimeUnit.SECONDS);
        assertFalse(failed.success());
        assertEquals(ErrorKind.NOT_AVAILABLE, failed.errorKind());
        assertEquals(OwnershipDirectory.UNCLAIMED, owner("pending-1"));
    }

    @Test
    void crashedWorkerIsRespawnedWithNewGeneration() throws Exception {
        long before = coordinator.generationOf(0).join();
        coordinator.killWorker(0);

        waitFor("respawn", () -> coordinator.generationOf(0).join() == before + 1);
        assertEquals(2, coordinator.health().join().get("workersAlive").asInt());
    }

    @Test
    void sessionIsReclaimedLazilyAfterCrash() throws Exception {
        call("erin", Action.START_SESSION, Envelopes.object());
        int index = owner("erin");
        long before = coordinator.generationOf(index).join();

        coordinator.killWorker(index);
        waitFor("respawn", () -> coordinator.generationOf(index).join() == before + 1);
        assertEquals(ErrorKind.NOT_FOUND, call("erin", Action.GET_STATUS, null).errorKind());

        assertTrue(call("erin", Action.START_SESSION, Envelopes.object()).success());
        assertEquals(index, owner("erin"));
        assertEquals(2, clients.created.stream().filter("erin"::equals).count());
        assertEquals(1, clients.open("erin"), "exactly one live handle after reclaim");
    }

    @Test
    void killClosesTheDeadWorkersHandles() throws Exception {
        call("pending-2", Action.START_SESSION, Envelopes.object());
        int index = owner("pending-2");
        assertEquals(1, clients.open("pending-2"));

        coordinator.killWorker(index);

        waitFor("handle closed", () -> clients.open("pending-2") == 0);
        assertEquals(OwnershipDirectory.UNCLAIMED, owner("pending-2"));
    }

    @Test
    void forwardToEmptySlotFailsImmediately() throws Exception {
        coordinator.close();
        cfg.respawnDelayMs = 10_000;
        coordinator = new Coordinator(cfg, new LocalWorkerLauncher(cfg, clients, new InMemoryCredentialStore(), SILENT));
        coordinator.start();

        int index = SessionPartitioner.partition("zoe", 2);
        waitFor("worker up", () -> coordinator.generationOf(index).join() > 0);
        coordinator.killWorker(index);
        waitFor("slot empty", () -> coordinator.generationOf(index).join() == 0L);

        long started = System.currentTimeMillis();
        WorkerSignal reply = coordinator.forward("zoe", Action.START_SESSION, Envelopes.object())
                .get(1, TimeUnit.SECONDS);
        assertFalse(reply.success());
        assertEquals(ErrorKind.NOT_AVAILABLE, reply.errorKind());
        assertTrue(System.currentTimeMillis() - started < cfg.ipcTimeoutMs);
    }

    @Test
    void signalsFromReplacedGenerationAreDropped() throws Exception {
        long before = coordinator.generationOf(1).join();
        coordinator.killWorker(1);
        waitFor("respawn", () -> coordinator.generationOf(1).join() == before + 1);

        coordinator.onSignal(WorkerSignal.claim(1, before, "ghost"));
        coordinator.onSignal(WorkerSignal.claim(1, before + 1, "live"));

        waitFor("live claim", () -> owner("live") == 1);
        assertEquals(OwnershipDirectory.UNCLAIMED, owner("ghost"));
    }

    @Test
    void healthReportsPool() {
        ObjectNode health = coordinator.health().join();
        assertEquals(2, health.get("workerCount").asInt());
        assertEquals(2, health.get("workersAlive").asInt());
        assertEquals(0, health.get("claimedSessions").asInt());
        assertEquals(0, health.get("pendingRequests").asInt());
    }

    @Test
    void restoreStartsStoredSessions() throws Exception {
        coordinator.restore(List.of("frank", "grace"));
        waitFor("restored", () -> owner("frank") != OwnershipDirectory.UNCLAIMED
                && owner("grace") != OwnershipDirectory.UNCLAIMED);
    }

    @Test
    void forwardAfterCloseFailsFast() throws Exception {
        coordinator.close();
        WorkerSignal reply = coordinator.forward("x", Action.GET_STATUS, null).get(1, TimeUnit.SECONDS);
        assertEquals(ErrorKind.NOT_AVAILABLE, reply.errorKind());
    }
}

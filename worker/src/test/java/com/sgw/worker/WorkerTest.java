package com.sgw.worker;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.common.GatewayConfig;
import com.sgw.protocol.Action;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.ErrorKind;
import com.sgw.protocol.WorkerCommand;
import com.sgw.protocol.WorkerSignal;
import com.sgw.worker.client.CloseCodes;
import com.sgw.worker.client.FakeProtocolClient;
import com.sgw.worker.client.ProtocolEvent;
import com.sgw.worker.client.RecipientUnreachableException;
import com.sgw.worker.notify.RecordingNotifier;
import com.sgw.worker.store.InMemoryCredentialStore;
import io.netty.channel.DefaultEventLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.sgw.worker.TestConfigs.waitFor;
import static org.junit.jupiter.api.Assertions.*;

class WorkerTest {

    private GatewayConfig cfg;
    private DefaultEventLoop loop;
    private FakeProtocolClient.Factory clients;
    private RecordingNotifier notifier;
    private final List<WorkerSignal> signals = new CopyOnWriteArrayList<>();
    private final AtomicInteger seq = new AtomicInteger();
    private Worker worker;

    @BeforeEach
    void setUp() {
        cfg      = TestConfigs.fast();
        loop     = new DefaultEventLoop();
        clients  = new FakeProtocolClient.Factory();
        notifier = new RecordingNotifier();
        signals.clear();
        worker = new Worker(2, 7L, cfg, loop, clients, new InMemoryCredentialStore(), notifier, signals::add);
    }

    @AfterEach
    void tearDown() {
        loop.shutdownGracefully(0, 100, TimeUnit.MILLISECONDS).syncUninterruptibly();
    }

    private WorkerSignal call(Action action, String sessionId, ObjectNode payload) throws InterruptedException {
        String requestId = "r" + seq.incrementAndGet();
        worker.submit(new WorkerCommand(action, requestId, sessionId, payload));
        waitFor("reply to " + requestId, () -> reply(requestId) != null);
        return reply(requestId);
    }

    private WorkerSignal reply(String requestId) {
        return signals.stream()
                .filter(s -> s.type() == WorkerSignal.Type.REPLY && requestId.equals(s.requestId()))
                .findFirst().orElse(null);
    }

    private long count(WorkerSignal.Type type, String sessionId) {
        return signals.stream().filter(s -> s.type() == type && sessionId.equals(s.sessionId())).count();
    }

    private void startConnected(String id) throws InterruptedException {
        call(Action.START_SESSION, id, Envelopes.object());
        clients.last(id).emit(new ProtocolEvent.Opened("15550001@s.whatsapp.net", null));
        waitFor("connected", () -> {
            try {
                return "connected".equals(call(Action.GET_STATUS, id, null).data().get("status").asText());
            } catch (InterruptedException e) {
                return false;
            }
        });
    }

    private static ObjectNode text(String to, String text) {
        return Envelopes.object().put("to", to).put("text", text);
    }

    // ---- start_session ----

    @Test
    void startClaimsImmediatelyAndRepliesInitializing() throws Exception {
        WorkerSignal reply = call(Action.START_SESSION, "a", Envelopes.object());

        assertTrue(reply.success());
        assertEquals("initializing", reply.data().get("status").asText());
        assertEquals(2, reply.workerIndex());
        assertEquals(7L, reply.generation());

        WorkerSignal claim = signals.get(0);
        assertEquals(WorkerSignal.Type.CLAIM, claim.type(), "claim precedes the reply");
        assertEquals("a", claim.sessionId());
    }

    @Test
    void secondStartIsIdempotent() throws Exception {
        call(Action.START_SESSION, "a", Envelopes.object());
        WorkerSignal second = call(Action.START_SESSION, "a", Envelopes.object());

        assertTrue(second.success());
        assertEquals("initializing", second.data().get("status").asText());
        assertEquals(1, clients.count("a"), "no duplicate protocol handle");
        assertEquals(1, count(WorkerSignal.Type.CLAIM, "a"));
    }

    @Test
    void startOnExpiredSessionRestartsIt() throws Exception {
        call(Action.START_SESSION, "a", Envelopes.object());
        clients.last("a").emit(new ProtocolEvent.PairingCode("qr"));
        waitFor("expired", () -> {
            try {
                return "expired".equals(call(Action.GET_STATUS, "a", null).data().get("status").asText());
            } catch (InterruptedException e) {
                return false;
            }
        });

        WorkerSignal again = call(Action.START_SESSION, "a", Envelopes.object());
        assertEquals("initializing", again.data().get("status").asText());
        assertEquals(2, clients.count("a"));
    }

    // ---- get_status ----

    @Test
    void statusOfUnknownSessionIsNotFound() throws Exception {
        WorkerSignal reply = call(Action.GET_STATUS, "ghost", null);
        assertFalse(reply.success());
        assertEquals(ErrorKind.NOT_FOUND, reply.errorKind());
    }

    @Test
    void statusReportsIdentityOnceConnected() throws Exception {
        startConnected("a");
        WorkerSignal reply = call(Action.GET_STATUS, "a", null);
        assertEquals("15550001", reply.data().get("identity").asText());
        assertEquals(0, reply.data().get("reconnectAttempts").asInt());
    }

    // ---- send ----

    @Test
    void sendToUnknownSessionFailsFast() throws Exception {
        WorkerSignal reply = call(Action.SEND_TEXT, "ghost", text("123", "hi"));
        assertEquals(ErrorKind.NOT_AVAILABLE, reply.errorKind());
    }

    @Test
    void sendRequiresRecipientAndText() throws Exception {
        call(Action.START_SESSION, "a", Envelopes.object());
        assertEquals(ErrorKind.BAD_REQUEST, call(Action.SEND_TEXT, "a", Envelopes.object().put("text", "hi")).errorKind());
        assertEquals(ErrorKind.BAD_REQUEST, call(Action.SEND_TEXT, "a", Envelopes.object().put("to", "1")).errorKind());
    }

    @Test
    void sendNormalizesBarePhoneNumbers() throws Exception {
        startConnected("a");
        WorkerSignal reply = call(Action.SEND_TEXT, "a", text("123", "hi"));

        assertTrue(reply.success());
        assertTrue(reply.data().get("delivered").asBoolean());
        assertEquals("msg-1", reply.data().get("id").asText());
        assertEquals("123@s.whatsapp.net", clients.last("a").recipients.get(0));

        call(Action.SEND_TEXT, "a", text("group-1@g.us", "hi"));
        assertEquals("group-1@g.us", clients.last("a").recipients.get(1));
    }

    @Test
    void sendWaitsForReconnectWithinCeiling() throws Exception {
        startConnected("a");
        clients.last("a").emit(new ProtocolEvent.Closed(CloseCodes.CONNECTION_LOST, "lost"));
        waitFor("reconnect handle", () -> clients.count("a") == 2);

        String requestId = "pending-send";
        worker.submit(new WorkerCommand(Action.SEND_TEXT, requestId, "a", text("123", "hi")));
        Thread.sleep(30);
        assertNull(reply(requestId), "held while reconnecting");

        clients.last("a").emit(new ProtocolEvent.Opened("15550001@s.whatsapp.net", null));
        waitFor("send reply", () -> reply(requestId) != null);
        assertTrue(reply(requestId).success());
    }

    @Test
    void sendFailsWhenSessionNeverConnects() throws Exception {
        call(Action.START_SESSION, "a", Envelopes.object());
        WorkerSignal reply = call(Action.SEND_TEXT, "a", text("123", "hi"));

        assertFalse(reply.success());
        assertEquals(ErrorKind.NOT_CONNECTED, reply.errorKind());
        assertEquals(0, clients.last("a").sendCalls.get());
    }

    @Test
    void transientSendFailureIsRetried() throws Exception {
        clients.onCreate = c -> c.sendScript.add(() -> CompletableFuture.failedFuture(new IOException("reset")));
        startConnected("a");

        WorkerSignal reply = call(Action.SEND_TEXT, "a", text("123", "hi"));
        assertTrue(reply.success());
        assertEquals(2, clients.last("a").sendCalls.get());
    }

    @Test
    void sendTimeoutsExhaustAttemptsAsTransportTimeout() throws Exception {
        clients.onCreate = c -> {
            for (int i = 0; i < 3; i++) c.sendScript.add(CompletableFuture::new);
        };
        startConnected("a");

        WorkerSignal reply = call(Action.SEND_TEXT, "a", text("123", "hi"));
        assertEquals(ErrorKind.TRANSPORT_TIMEOUT, reply.errorKind());
        assertEquals(cfg.sendMaxAttempts, clients.last("a").sendCalls.get());
    }

    @Test
    void recipientProblemsAreNotRetried() throws Exception {
        clients.onCreate = c -> c.sendScript.add(
                () -> CompletableFuture.failedFuture(new RecipientUnreachableException("not on network")));
        startConnected("a");

        WorkerSignal reply = call(Action.SEND_TEXT, "a", text("123", "hi"));
        assertEquals(ErrorKind.RECIPIENT_UNREACHABLE, reply.errorKind());
        assertEquals(1, clients.last("a").sendCalls.get());
    }

    @Test
    void sendMediaDecodesBase64() throws Exception {
        startConnected("a");
        String media = Base64.getEncoder().encodeToString(new byte[]{1, 2, 3});

        WorkerSignal ok = call(Action.SEND_MEDIA, "a",
                Envelopes.object().put("to", "123").put("media", media).put("caption", "pic"));
        assertTrue(ok.success());

        WorkerSignal bad = call(Action.SEND_MEDIA, "a", Envelopes.object().put("to", "123").put("media", "%%%"));
        assertEquals(ErrorKind.BAD_REQUEST, bad.errorKind());
    }

    // ---- leaving the worker ----

    @Test
    void disconnectLogsOutAndReleases() throws Exception {
        startConnected("a");
        WorkerSignal reply = call(Action.DISCONNECT, "a", null);

        assertTrue(reply.success());
        assertTrue(clients.last("a").loggedOut);
        assertEquals(1, count(WorkerSignal.Type.RELEASE, "a"));
        assertEquals(ErrorKind.NOT_FOUND, call(Action.GET_STATUS, "a", null).errorKind());
    }

    @Test
    void disconnectOfUnknownSessionStillSucceeds() throws Exception {
        assertTrue(call(Action.DISCONNECT, "ghost", null).success());
    }

    @Test
    void remoteLogoutReleasesOwnership() throws Exception {
        startConnected("a");
        clients.last("a").emit(new ProtocolEvent.Closed(CloseCodes.LOGGED_OUT, "revoked"));

        waitFor("release", () -> count(WorkerSignal.Type.RELEASE, "a") == 1);
        assertEquals(ErrorKind.NOT_FOUND, call(Action.GET_STATUS, "a", null).errorKind());
    }

    @Test
    void shutdownDropsSessionsWithoutLogout() throws Exception {
        startConnected("a");
        worker.shutdown().get(1, TimeUnit.SECONDS);

        assertTrue(clients.last("a").closed);
        assertFalse(clients.last("a").loggedOut);
        assertEquals(0, count(WorkerSignal.Type.RELEASE, "a"));
    }

    @Test
    void recipientNormalization() {
        assertEquals("49170@s.whatsapp.net", Worker.normalizeRecipient("49170", "s.whatsapp.net"));
        assertEquals("x@g.us", Worker.normalizeRecipient("x@g.us", "s.whatsapp.net"));
    }

    @Test
    void sendFailureClassification() {
        assertEquals(ErrorKind.RECIPIENT_UNREACHABLE,
                Worker.classifySendFailure(new RecipientUnreachableException("blocked")));
        assertEquals(ErrorKind.TRANSPORT_TIMEOUT, Worker.classifySendFailure(new TimeoutException()));
        assertEquals(ErrorKind.TRANSPORT_TIMEOUT, Worker.classifySendFailure(new IOException("reset")));
        assertEquals(ErrorKind.NOT_CONNECTED,
                Worker.classifySendFailure(new ActionException(ErrorKind.NOT_CONNECTED, "x")));
        assertEquals(ErrorKind.INTERNAL, Worker.classifySendFailure(new IllegalStateException()));
    }
}

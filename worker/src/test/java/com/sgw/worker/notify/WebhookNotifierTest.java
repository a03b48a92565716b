package com.sgw.worker.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.sgw.common.GatewayConfig;
import com.sgw.protocol.Envelopes;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.sgw.worker.TestConfigs.waitFor;
import static org.junit.jupiter.api.Assertions.*;

class WebhookNotifierTest {

    record Received(String path, JsonNode body) {}

    private EventLoopGroup group;
    private Channel server;
    private final List<Received> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger failFirst = new AtomicInteger();

    @BeforeEach
    void startBackend() throws Exception {
        group = new NioEventLoopGroup(2);
        server = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(1 << 20))
                                .addLast(new SimpleChannelInboundHandler<FullHttpRequest>() {
                                    @Override
                                    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) throws Exception {
                                        HttpResponseStatus status = HttpResponseStatus.OK;
                                        if (failFirst.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                                            status = HttpResponseStatus.SERVICE_UNAVAILABLE;
                                        } else {
                                            String body = req.content().toString(StandardCharsets.UTF_8);
                                            received.add(new Received(req.uri(), Envelopes.MAPPER.readTree(body)));
                                        }
                                        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status);
                                        resp.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
                                        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
                                    }
                                });
                    }
                })
                .bind("127.0.0.1", 0).sync().channel();
    }

    @AfterEach
    void stopBackend() {
        server.close().syncUninterruptibly();
        group.shutdownGracefully(0, 100, TimeUnit.MILLISECONDS).syncUninterruptibly();
    }

    private WebhookNotifier notifier(int retries) throws Exception {
        GatewayConfig cfg = new GatewayConfig();
        cfg.webhookBaseUrl      = "http://127.0.0.1:" + ((InetSocketAddress) server.localAddress()).getPort() + "/";
        cfg.webhookPath         = "/whatsapp/webhook";
        cfg.webhookRetries      = retries;
        cfg.webhookRetryDelayMs = 10;
        cfg.webhookTimeoutMs    = 1_000;
        return new WebhookNotifier(cfg, group);
    }

    @Test
    void postsEnvelopeToEventEndpoint() throws Exception {
        notifier(0).publish("s1", WebhookEvent.PAIRING_READY,
                Envelopes.object().put("code", "abc").put("expiresInSeconds", 60));

        waitFor("webhook", () -> received.size() == 1);
        Received r = received.get(0);
        assertEquals("/whatsapp/webhook/qr", r.path());
        assertEquals("s1", r.body().get("session_id").asText());
        assertEquals("pairing_ready", r.body().get("event").asText());
        assertEquals("abc", r.body().path("data").path("code").asText());
    }

    @Test
    void logoutAndDisconnectShareEndpoint() throws Exception {
        WebhookNotifier n = notifier(0);
        n.publish("s1", WebhookEvent.LOGGED_OUT, null);
        n.publish("s2", WebhookEvent.DISCONNECTED, Envelopes.object().put("reason", "max_retries"));

        waitFor("both webhooks", () -> received.size() == 2);
        for (Received r : received) {
            assertEquals("/whatsapp/webhook/disconnect", r.path());
            assertTrue(r.body().get("data").isObject());
        }
    }

    @Test
    void serverErrorsAreRetried() throws Exception {
        failFirst.set(2);
        notifier(2).publish("s1", WebhookEvent.CONNECTED, Envelopes.object().put("identity", "1555"));

        waitFor("delivery after retries", () -> received.size() == 1);
        assertEquals("/whatsapp/webhook/connected", received.get(0).path());
    }

    @Test
    void givesUpWhenRetriesExhausted() throws Exception {
        failFirst.set(5);
        notifier(1).publish("s1", WebhookEvent.CONNECTED, Envelopes.object());

        waitFor("two attempts", () -> failFirst.get() == 3);
        Thread.sleep(100);
        assertEquals(3, failFirst.get());
        assertTrue(received.isEmpty());
    }

    @Test
    void unreachableBackendNeverThrows() throws Exception {
        GatewayConfig cfg = new GatewayConfig();
        cfg.webhookBaseUrl      = "http://127.0.0.1:1";
        cfg.webhookRetries      = 1;
        cfg.webhookRetryDelayMs = 10;
        cfg.webhookTimeoutMs    = 200;
        WebhookNotifier n = new WebhookNotifier(cfg, group);

        assertFalse(n.post("/x", new byte[0]).await().isSuccess());
        assertDoesNotThrow(() -> n.publish("s1", WebhookEvent.CONNECTED, Envelopes.object()));
    }
}

package com.sgw.worker.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.common.GatewayConfig;
import com.sgw.protocol.Envelopes;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Posts {@code {session_id, event, data}} to the backend webhook over Netty's HTTP client.
 *
 * One short-lived connection per attempt; a failed attempt (connect error, timeout,
 * non-2xx) is retried {@code webhookRetries} times after {@code webhookRetryDelayMs}.
 * Callers are never blocked and never see a failure.
 */
public final class WebhookNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private final EventLoopGroup group;
    private final String host;
    private final int    port;
    private final String basePath;
    private final SslContext sslContext;
    private final int    retries;
    private final long   retryDelayMs;
    private final long   timeoutMs;

    public WebhookNotifier(GatewayConfig cfg, EventLoopGroup group) throws SSLException {
        URI base = URI.create(cfg.webhookBaseUrl);
        boolean https = "https".equalsIgnoreCase(base.getScheme());
        this.group        = group;
        this.host         = base.getHost();
        this.port         = base.getPort() > 0 ? base.getPort() : (https ? 443 : 80);
        this.basePath     = stripTrailingSlash(base.getRawPath()) + cfg.webhookPath;
        this.sslContext   = https ? SslContextBuilder.forClient().build() : null;
        this.retries      = cfg.webhookRetries;
        this.retryDelayMs = cfg.webhookRetryDelayMs;
        this.timeoutMs    = cfg.webhookTimeoutMs;
        log.info("Webhook sink: {}://{}:{}{}/*", https ? "https" : "http", host, port, basePath);
    }

    @Override
    public void publish(String sessionId, WebhookEvent event, ObjectNode data) {
        ObjectNode body = Envelopes.object()
                .put("session_id", sessionId)
                .put("event", event.wireName);
        body.set("data", data != null ? data : Envelopes.object());
        byte[] bytes;
        try {
            bytes = Envelopes.MAPPER.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.warn("[{}] cannot serialize {} event", sessionId, event.wireName, e);
            return;
        }
        attempt(sessionId, event, bytes, 0);
    }

    private void attempt(String sessionId, WebhookEvent event, byte[] body, int attempt) {
        String path = basePath + event.pathSuffix;
        post(path, body).addListener(f -> {
            if (f.isSuccess()) {
                log.debug("[{}] sent {} -> {}", sessionId, event.wireName, path);
            } else if (attempt < retries) {
                group.schedule(() -> attempt(sessionId, event, body, attempt + 1), retryDelayMs, TimeUnit.MILLISECONDS);
            } else {
                log.warn("[{}] failed to notify backend of {} after {} attempts: {}",
                        sessionId, event.wireName, attempt + 1, f.cause().toString());
            }
        });
    }

    Future<Integer> post(String path, byte[] body) {
        Promise<Integer> promise = group.next().newPromise();
        Bootstrap b = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMs)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (sslContext != null) ch.pipeline().addLast(sslContext.newHandler(ch.alloc(), host, port));
                        ch.pipeline()
                                .addLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                                .addLast(new HttpClientCodec())
                                .addLast(new HttpObjectAggregator(64 * 1024))
                                .addLast(new ResponseHandler(promise));
                    }
                });

        b.connect(host, port).addListener((ChannelFutureListener) cf -> {
            if (!cf.isSuccess()) {
                promise.tryFailure(cf.cause());
                return;
            }
            FullHttpRequest req = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, path,
                    Unpooled.wrappedBuffer(body));
            req.headers()
                    .set(HttpHeaderNames.HOST, host + ":" + port)
                    .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                    .set(HttpHeaderNames.CONTENT_LENGTH, body.length)
                    .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            cf.channel().writeAndFlush(req);
        });
        return promise;
    }

    private static String stripTrailingSlash(String path) {
        if (path == null) return "";
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

        private final Promise<Integer> promise;

        ResponseHandler(Promise<Integer> promise) { this.promise = promise; }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse resp) {
            int code = resp.status().code();
            if (code >= 200 && code < 300) {
                promise.trySuccess(code);
            } else {
                promise.tryFailure(new IOException("HTTP " + code));
            }
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            promise.tryFailure(new IOException("connection closed before response"));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            promise.tryFailure(cause);
            ctx.close();
        }
    }
}

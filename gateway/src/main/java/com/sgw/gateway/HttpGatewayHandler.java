package com.sgw.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.protocol.Action;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.ErrorKind;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Per-channel handler for the control surface.
 *
 *   POST /session/start              {session_id}
 *   POST /session/{id}/send          {to, text}
 *   POST /session/{id}/send-media    {to, media, caption?}
 *   POST /session/{id}/disconnect
 *   GET  /session/{id}/status
 *   GET  /health
 *
 * Requests are validated here and rejected with 400 before anything is forwarded.
 * Worker failures map to HTTP status by {@link ErrorKind}.
 */
public final class HttpGatewayHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(HttpGatewayHandler.class);

    private final SessionRouter router;

    public HttpGatewayHandler(SessionRouter router) {
        this.router = router;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        boolean keepAlive = HttpUtil.isKeepAlive(req);
        if (HttpMethod.OPTIONS.equals(req.method())) {
            write(ctx, HttpResponseStatus.NO_CONTENT, null, keepAlive);
            return;
        }

        String path = new QueryStringDecoder(req.uri()).path();
        List<String> parts = segments(path);

        JsonNode body;
        try {
            body = readBody(req);
        } catch (IOException e) {
            writeError(ctx, ErrorKind.BAD_REQUEST, "malformed JSON body", keepAlive);
            return;
        }

        HttpMethod method = req.method();
        if (method.equals(HttpMethod.GET) && parts.size() == 1 && parts.get(0).equals("health")) {
            router.health().whenComplete((health, err) -> {
                if (err != null) writeError(ctx, ErrorKind.NOT_AVAILABLE, "gateway shutting down", keepAlive);
                else write(ctx, HttpResponseStatus.OK, health, keepAlive);
            });
            return;
        }
        if (parts.isEmpty() || !parts.get(0).equals("session")) {
            writeError(ctx, ErrorKind.NOT_FOUND, "no route for " + method + " " + path, keepAlive);
            return;
        }

        if (method.equals(HttpMethod.POST) && parts.size() == 2 && parts.get(1).equals("start")) {
            String sessionId = body.path("session_id").asText("");
            if (sessionId.isEmpty()) {
                writeError(ctx, ErrorKind.BAD_REQUEST, "session_id is required", keepAlive);
                return;
            }
            forward(ctx, sessionId, Action.START_SESSION, Envelopes.object(), keepAlive);
            return;
        }

        if (parts.size() != 3) {
            writeError(ctx, ErrorKind.NOT_FOUND, "no route for " + method + " " + path, keepAlive);
            return;
        }
        String sessionId = parts.get(1);
        String verb      = parts.get(2);

        if (method.equals(HttpMethod.POST) && verb.equals("send")) {
            String to   = body.path("to").asText("");
            String text = body.path("text").asText("");
            if (to.isEmpty() || text.isEmpty()) {
                writeError(ctx, ErrorKind.BAD_REQUEST, "to and text are required", keepAlive);
                return;
            }
            forward(ctx, sessionId, Action.SEND_TEXT, Envelopes.object().put("to", to).put("text", text), keepAlive);
        } else if (method.equals(HttpMethod.POST) && verb.equals("send-media")) {
            String to    = body.path("to").asText("");
            String media = body.path("media").asText("");
            if (to.isEmpty() || media.isEmpty()) {
                writeError(ctx, ErrorKind.BAD_REQUEST, "to and media are required", keepAlive);
                return;
            }
            ObjectNode payload = Envelopes.object().put("to", to).put("media", media);
            if (body.hasNonNull("caption")) payload.put("caption", body.get("caption").asText());
            forward(ctx, sessionId, Action.SEND_MEDIA, payload, keepAlive);
        } else if (method.equals(HttpMethod.POST) && verb.equals("disconnect")) {
            forward(ctx, sessionId, Action.DISCONNECT, Envelopes.object(), keepAlive);
        } else if (method.equals(HttpMethod.GET) && verb.equals("status")) {
            forward(ctx, sessionId, Action.GET_STATUS, Envelopes.object(), keepAlive);
        } else {
            writeError(ctx, ErrorKind.NOT_FOUND, "no route for " + method + " " + path, keepAlive);
        }
    }

    private void forward(ChannelHandlerContext ctx, String sessionId, Action action, JsonNode payload,
                         boolean keepAlive) {
        router.forward(sessionId, action, payload).whenComplete((reply, err) -> {
            if (err != null) {
                log.error("[{}] {} failed unexpectedly", sessionId, action.wireName, err);
                writeError(ctx, ErrorKind.INTERNAL, err.toString(), keepAlive);
            } else if (!reply.success()) {
                ErrorKind kind = reply.errorKind() != null ? reply.errorKind() : ErrorKind.INTERNAL;
                writeError(ctx, kind, reply.error(), keepAlive);
            } else {
                ObjectNode out = Envelopes.object().put("success", true);
                if (reply.data() instanceof ObjectNode data) out.setAll(data);
                write(ctx, HttpResponseStatus.OK, out, keepAlive);
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel error", cause);
        ctx.close();
    }

    // ---- Helpers ----

    private static JsonNode readBody(FullHttpRequest req) throws IOException {
        if (req.content().readableBytes() == 0) return Envelopes.object();
        try (ByteBufInputStream in = new ByteBufInputStream(req.content())) {
            JsonNode node = Envelopes.MAPPER.readTree(in);
            return node != null ? node : Envelopes.object();
        }
    }

    static List<String> segments(String path) {
        return Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .map(QueryStringDecoder::decodeComponent)
                .toList();
    }

    private static void writeError(ChannelHandlerContext ctx, ErrorKind kind, String error, boolean keepAlive) {
        ObjectNode body = Envelopes.object()
                .put("success", false)
                .put("error", error != null ? error : kind.wireName)
                .put("kind", kind.wireName);
        write(ctx, HttpResponseStatus.valueOf(kind.httpStatus), body, keepAlive);
    }

    private static void write(ChannelHandlerContext ctx, HttpResponseStatus status, ObjectNode body, boolean keepAlive) {
        byte[] bytes;
        try {
            bytes = body == null ? new byte[0] : Envelopes.MAPPER.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize response", e);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            bytes  = new byte[0];
        }
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        HttpHeaders headers = resp.headers();
        headers.set(HttpHeaderNames.CONTENT_LENGTH, bytes.length)
               .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
               .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
               .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type");
        if (body != null) headers.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        if (keepAlive) {
            headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(resp);
        } else {
            ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
        }
    }
}

package com.sgw.gateway;

import com.sgw.common.GatewayConfig;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty HTTP server for the session control surface.
 *
 * Pipeline per channel:
 *   HttpServerCodec -> HttpObjectAggregator(httpMaxContentLength) -> HttpGatewayHandler
 */
public final class HttpGatewayServer {

    private static final Logger log = LoggerFactory.getLogger(HttpGatewayServer.class);

    private final GatewayConfig cfg;
    private final SessionRouter router;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public HttpGatewayServer(GatewayConfig cfg, SessionRouter router) {
        this.cfg    = cfg;
        this.router = router;
    }

    public void start() throws InterruptedException {
        bossGroup   = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                // media uploads arrive base64-encoded in the body
                                .addLast(new HttpObjectAggregator(cfg.httpMaxContentLength))
                                .addLast(new HttpGatewayHandler(router));
                    }
                });

        ChannelFuture future = bootstrap.bind(cfg.httpPort).sync();
        serverChannel = future.channel();
        log.info("HTTP control surface listening on port {}", cfg.httpPort);
    }

    public void stop() throws InterruptedException {
        if (serverChannel != null) serverChannel.close().sync();
        if (bossGroup   != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        log.info("HTTP control surface stopped.");
    }
}

package com.planningpoker.server;

import com.planningpoker.service.SessionCoordinator;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * HTTP server exposing the poker WebSocket at {@code /ws} and the browser client everywhere else.
 *
 * <p>Each connection gets a heartbeat: a ping after {@code heartbeatInterval} without writes,
 * and a forced close after {@code clientTimeout} without reads.
 */
public class PokerWebServer {
    private static final Logger log = LoggerFactory.getLogger(PokerWebServer.class);
    public static final String WEBSOCKET_PATH = "/ws";
    private static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private final ServerConfig config;
    private final SessionCoordinator coordinator;
    private final MultiThreadIoEventLoopGroup bossGroup;
    private final MultiThreadIoEventLoopGroup workerGroup;
    private Channel serverChannel;

    public PokerWebServer(ServerConfig config, SessionCoordinator coordinator) {
        this.config = config;
        this.coordinator = coordinator;
        this.bossGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        this.workerGroup = new MultiThreadIoEventLoopGroup(NioIoHandler.newFactory());
    }

    /**
     * Binds the listen address.
     *
     * @return the bound port, useful when the configured port is 0
     */
    public int start() throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        p.addLast(new IdleStateHandler(config.clientTimeout.toMillis(),
                                config.heartbeatInterval.toMillis(), 0, TimeUnit.MILLISECONDS));
                        p.addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH, null, false));
                        p.addLast(new PokerWebSocketHandler(coordinator));
                        p.addLast(new StaticFileHandler(config.staticDir));
                    }
                });

        try {
            serverChannel = bootstrap.bind(config.listenInterface, config.port).sync().channel();
        } catch (Exception e) {
            // sync() rethrows bind failures such as BindException without declaring them
            log.error("Failed to bind {}:{}", config.listenInterface, config.port, e);
            stop();
            throw e;
        }
        int boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Listening on {}:{} (WebSocket at {})", config.listenInterface, boundPort, WEBSOCKET_PATH);
        return boundPort;
    }

    /**
     * Blocks until the server channel is closed.
     */
    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    boolean isShuttingDown() {
        return bossGroup.isShuttingDown() && workerGroup.isShuttingDown();
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        log.info("Web server stopped");
    }
}

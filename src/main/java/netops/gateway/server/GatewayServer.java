package netops.gateway.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import netops.gateway.broadcast.EventBroadcaster;
import netops.gateway.broadcast.WebSocketSessionHandler;
import netops.gateway.config.GatewayConfig;
import netops.gateway.proxy.ProxyConnector;
import netops.gateway.proxy.ProxyFrontHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server: proxy front, WebSocket endpoint and API router on one port.
 * <p>
 * Pipeline: idle timeout, HTTP codec, proxy front (streams {@code /api/{service}/**}), aggregator,
 * WebSocket upgrade on {@code /ws}, WebSocket session, router.
 */
public final class GatewayServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);

    public static final String WEBSOCKET_PATH = "/ws";
    static final int IDLE_SECONDS = 60;

    private final GatewayConfig config;
    private final RouterHandler router;
    private final ProxyConnector proxy;
    private final EventBroadcaster broadcaster;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public GatewayServer(GatewayConfig config, RouterHandler router, ProxyConnector proxy,
            EventBroadcaster broadcaster) {
        this.config = config;
        this.router = router;
        this.proxy = proxy;
        this.broadcaster = broadcaster;
    }

    ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast("idle", new IdleStateHandler(IDLE_SECONDS, 0, 0, TimeUnit.SECONDS));
                p.addLast("http", new HttpServerCodec());
                p.addLast("proxy", new ProxyFrontHandler(proxy));
                p.addLast("aggregator", new HttpObjectAggregator(config.maxContentLength()));
                p.addLast("ws", new WebSocketServerProtocolHandler(WEBSOCKET_PATH, null, true));
                p.addLast("ws-session", new WebSocketSessionHandler(broadcaster));
                p.addLast("router", router);
            }
        };
    }

    /**
     * Bind and start accepting connections. Port 0 picks an ephemeral port.
     *
     * @return the bound port
     */
    public synchronized int start() throws InterruptedException {
        if (serverChannel != null) {
            return port();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.ioThreads());
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(config.serverHost(), config.serverPort()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            stop();
            throw e;
        }
        log.info("Gateway listening on {}:{}", config.serverHost(), port());
        return port();
    }

    public int port() {
        return serverChannel == null ? -1 : ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
                bossGroup = null;
            }
        }
        log.info("Gateway server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}

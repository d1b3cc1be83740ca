package netops.gateway.proxy;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import netops.gateway.auth.RequestGuard;
import netops.gateway.config.BackendService;

import javax.net.ssl.SSLException;
import java.time.Duration;

/**
 * Shared state for proxy connections: route table, admission checks and backend bootstrap.
 * Backend channels run on the inbound connection's event loop, so both sides of a relay are
 * driven by one thread.
 */
public class ProxyConnector {

    private final ProxyRoutes routes;
    private final RequestGuard guard;
    private final Duration connectTimeout;
    private final SslContext sslContext;

    public ProxyConnector(ProxyRoutes routes, RequestGuard guard, Duration connectTimeout) {
        this.routes = routes;
        this.guard = guard;
        this.connectTimeout = connectTimeout;
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to initialize TLS client context", e);
        }
    }

    public ProxyRoutes routes() {
        return routes;
    }

    public RequestGuard guard() {
        return guard;
    }

    ChannelFuture connect(EventLoop eventLoop, BackendService service, BackendRelayHandler relay) {
        Bootstrap bootstrap = new Bootstrap()
                .group(eventLoop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (service.isTls()) {
                            ch.pipeline().addLast("tls", sslContext.newHandler(ch.alloc(), service.host(),
                                    service.port()));
                        }
                        ch.pipeline().addLast("http-client", new HttpClientCodec());
                        ch.pipeline().addLast("relay", relay);
                    }
                });
        return bootstrap.connect(service.host(), service.port());
    }

    /** Host header value for the backend, default ports omitted */
    static String hostHeader(BackendService service) {
        int port = service.port();
        boolean defaultPort = service.isTls() ? port == 443 : port == 80;
        return defaultPort ? service.host() : service.host() + ":" + port;
    }
}

package netops.gateway.proxy;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;
import netops.gateway.api.Controller.ControllerResponse;
import netops.gateway.api.ErrorResponse;
import netops.gateway.auth.RequestGuard;
import netops.gateway.auth.TokenAuthenticator.AuthenticatedUser;
import netops.gateway.client.BackendClient;
import netops.gateway.config.BackendService;
import netops.gateway.error.GatewayException;
import netops.gateway.server.HttpResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-connection front of the proxy. Sits between the HTTP codec and the aggregator.
 * <p>
 * Requests under {@code /api/{service}/} for a registered backend are admitted (rate limit, token),
 * rewritten and streamed to the backend piece by piece. Everything else continues down the pipeline
 * to the API router. While a backend connection is being opened, inbound reads are paused and the
 * already decoded parts of the request are held back. A {@code 101 Switching Protocols} answer turns
 * the connection into a raw byte relay in both directions.
 */
public class ProxyFrontHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(ProxyFrontHandler.class);

    static final String USER_HEADER = "X-User-Id";
    static final String FORWARDED_FOR = "X-Forwarded-For";

    enum Mode {
        /** not proxied, handled further down the pipeline */
        PASS,
        /** streaming the current request to the backend */
        FORWARD,
        /** rejected request, rest of its body is dropped */
        DISCARD,
        /** protocol switched, bytes relayed as they are */
        RELAY
    }

    private final ProxyConnector connector;

    private ChannelHandlerContext ctx;
    private Mode mode = Mode.PASS;
    private boolean keepAlive = true;

    private Channel backend;
    private BackendRelayHandler relay;
    private BackendService backendService;
    private boolean connecting;
    private final List<Object> pending = new ArrayList<>();

    public ProxyFrontHandler(ProxyConnector connector) {
        this.connector = connector;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    Mode mode() {
        return mode;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (mode == Mode.RELAY) {
            relayToBackend(msg);
            return;
        }
        if (msg instanceof HttpRequest request) {
            mode = admit(request);
        }

        switch (mode) {
            case PASS -> ctx.fireChannelRead(msg);
            case DISCARD -> ReferenceCountUtil.release(msg);
            case FORWARD -> forward(msg);
            default -> ReferenceCountUtil.release(msg);
        }
        if (msg instanceof LastHttpContent && mode != Mode.RELAY) {
            mode = Mode.PASS;
        }
    }

    private Mode admit(HttpRequest request) {
        if (request.decoderResult().isFailure()) {
            return Mode.PASS;
        }
        Optional<ProxyRoutes.Route> route = connector.routes().match(request.uri());
        if (route.isEmpty()) {
            return Mode.PASS;
        }
        keepAlive = HttpUtil.isKeepAlive(request);
        String clientIp = RequestGuard.clientIp(ctx.channel());

        Optional<AuthenticatedUser> user;
        try {
            user = connector.guard().admit(clientIp, request.headers());
        } catch (GatewayException e) {
            log.debug("Proxy request {} {} rejected: {}", request.method(), request.uri(), e.getMessage());
            HttpResponses.write(ctx, HttpResponses.build(e), keepAlive);
            return Mode.DISCARD;
        }

        BackendService service = route.get().service();
        log.debug("Proxying {} {} -> {}{}", request.method(), request.uri(), service.name(), route.get().uri());
        rewrite(request, route.get(), user, clientIp);
        ensureBackend(service);
        if (backend == null) {
            // connect failed on the spot and the 502 is already written
            return Mode.DISCARD;
        }
        relay.expectResponse();
        return Mode.FORWARD;
    }

    private static void rewrite(HttpRequest request, ProxyRoutes.Route route, Optional<AuthenticatedUser> user,
            String clientIp) {
        HttpHeaders headers = request.headers();
        String originalHost = headers.get(HttpHeaderNames.HOST);
        request.setUri(route.uri());
        headers.set(HttpHeaderNames.HOST, ProxyConnector.hostHeader(route.service()));
        if (originalHost != null) {
            headers.set("X-Forwarded-Host", originalHost);
        }

        // callers never get to assert their own identity
        headers.remove(USER_HEADER);
        user.map(AuthenticatedUser::userId).ifPresent(id -> headers.set(USER_HEADER, id));

        String forwardedFor = headers.get(FORWARDED_FOR);
        headers.set(FORWARDED_FOR, forwardedFor == null || forwardedFor.isBlank()
                ? clientIp
                : forwardedFor + ", " + clientIp);
    }

    private void ensureBackend(BackendService service) {
        if (backend != null && service.equals(backendService) && (connecting || backend.isActive())) {
            return;
        }
        if (backend != null) {
            backend.close();
            releasePending();
        }
        backendService = service;
        connecting = true;
        ctx.channel().config().setAutoRead(false);

        relay = new BackendRelayHandler(this);
        ChannelFuture connect = connector.connect(ctx.channel().eventLoop(), service, relay);
        backend = connect.channel();
        connect.addListener((ChannelFutureListener) this::onConnected);
    }

    private void onConnected(ChannelFuture future) {
        if (future.channel() != backend) {
            // superseded by a connection to another service
            future.channel().close();
            return;
        }
        connecting = false;
        ctx.channel().config().setAutoRead(true);

        if (!ctx.channel().isActive()) {
            releasePending();
            future.channel().close();
            return;
        }

        if (future.isSuccess()) {
            log.debug("Connected to backend {} ({})", backendService.name(), backendService.baseUrl());
            for (Object msg : pending) {
                backend.write(msg);
            }
            pending.clear();
            backend.flush();
            return;
        }

        String reason = BackendClient.describe(future.cause());
        log.warn("Backend {} unavailable: {}", backendService.name(), reason);
        boolean requestComplete = pending.stream().anyMatch(m -> m instanceof LastHttpContent);
        releasePending();
        backend = null;
        relay = null;
        if (mode == Mode.FORWARD && !requestComplete) {
            mode = Mode.DISCARD;
        }
        writeError(HttpResponseStatus.BAD_GATEWAY, "Service unavailable",
                "Cannot reach " + backendService.name() + ": " + reason);
    }

    private void forward(Object msg) {
        if (connecting) {
            pending.add(msg);
            return;
        }
        if (backend == null || !backend.isActive()) {
            ReferenceCountUtil.release(msg);
            return;
        }
        backend.writeAndFlush(msg).addListener(closeOnFailure("write to backend"));
        if (!backend.isWritable()) {
            ctx.channel().config().setAutoRead(false);
        }
    }

    private void relayToBackend(Object msg) {
        if (backend == null || !backend.isActive()) {
            ReferenceCountUtil.release(msg);
            ctx.close();
            return;
        }
        backend.writeAndFlush(msg).addListener(closeOnFailure("relay to backend"));
        if (!backend.isWritable()) {
            ctx.channel().config().setAutoRead(false);
        }
    }

    // Called by BackendRelayHandler, always on this channel's event loop

    void writeToClient(Object msg, boolean closeAfter) {
        ChannelFuture write = ctx.writeAndFlush(msg).addListener(closeOnFailure("write to client"));
        if (closeAfter) {
            write.addListener(ChannelFutureListener.CLOSE);
        }
        if (!ctx.channel().isWritable() && backend != null) {
            backend.config().setAutoRead(false);
        }
    }

    /**
     * The backend accepted a protocol switch. Drop the HTTP codecs on both sides so bytes flow untouched.
     */
    void switchToRelay(ChannelHandlerContext backendCtx) {
        log.debug("Protocol switched, relaying raw bytes to {}", backendService.name());
        mode = Mode.RELAY;
        backendCtx.pipeline().remove(HttpClientCodec.class);
        if (ctx.pipeline().get(HttpServerCodec.class) != null) {
            ctx.pipeline().remove(HttpServerCodec.class);
        }
    }

    void backendWritabilityChanged(boolean writable) {
        if (!connecting) {
            ctx.channel().config().setAutoRead(writable);
        }
    }

    void backendClosed(Channel channel, boolean responseIncomplete, boolean awaitingResponse) {
        if (channel != backend) {
            return;
        }
        backend = null;
        relay = null;
        if (mode == Mode.RELAY || responseIncomplete) {
            ctx.close();
        } else if (awaitingResponse) {
            writeError(HttpResponseStatus.BAD_GATEWAY, "Service unavailable",
                    backendService.name() + " closed the connection without a response");
        }
    }

    private void writeError(HttpResponseStatus status, String error, String detail) {
        HttpResponses.write(ctx, HttpResponses.build(ControllerResponse.json(status,
                new ErrorResponse(error, detail, status.code()))), keepAlive);
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (backend != null) {
            backend.config().setAutoRead(ctx.channel().isWritable());
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            // only plain keep-alive HTTP connections with nothing in flight are reaped
            boolean plainHttp = ctx.pipeline().get(HttpServerCodec.class) != null;
            if (plainHttp && mode == Mode.PASS && backend == null) {
                log.debug("Closing idle connection {}", ctx.channel().remoteAddress());
                ctx.close();
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        releasePending();
        if (backend != null) {
            backend.close();
            backend = null;
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        if (mode == Mode.PASS) {
            super.exceptionCaught(ctx, cause);
            return;
        }
        log.warn("Proxy connection error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    private void releasePending() {
        for (Object msg : pending) {
            ReferenceCountUtil.release(msg);
        }
        pending.clear();
    }

    private ChannelFutureListener closeOnFailure(String action) {
        return future -> {
            if (!future.isSuccess()) {
                log.debug("Proxy {} failed: {}", action, future.cause() == null ? "" : future.cause().getMessage());
                future.channel().close();
            }
        };
    }
}

package netops.gateway.server;

import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpUtil;
import netops.gateway.api.Controller;
import netops.gateway.api.Controller.ControllerResponse;
import netops.gateway.auth.RequestGuard;
import netops.gateway.config.GatewayConfig;
import netops.gateway.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 * <p>
 * Every {@code /api/**} request counts against the caller's rate limit; {@code /api/v1/**} also
 * requires a valid bearer token when one is presented or required. Gateway errors become
 * {@code {error, detail, status_code}} bodies; unexpected faults become 500 with the detail
 * withheld in production.
 * <p>
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new ArrayList<>();
    private final GatewayConfig config;
    private final RequestGuard guard;

    public RouterHandler(GatewayConfig config, RequestGuard guard) {
        this.config = config;
        this.guard = guard;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        if (req.decoderResult().isFailure()) {
            write(ctx, ControllerResponse.error(BAD_REQUEST, "Bad request",
                    String.valueOf(req.decoderResult().cause())), keepAlive);
            return;
        }

        try {
            admit(ctx, req, path);

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    respond(ctx, method, path, controller.handleAsync(ctx, req, path), keepAlive);
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, ControllerResponse.error(NOT_FOUND, "Not found", "No route for " + method + " " + path),
                    keepAlive);

        } catch (Exception e) {
            writeFailure(ctx, method, path, e, keepAlive);
        }
    }

    /**
     * Write now if the answer is ready. Otherwise stop reading from the connection until the answer
     * is written, so responses keep request order.
     */
    private void respond(ChannelHandlerContext ctx, HttpMethod method, String path,
            CompletableFuture<ControllerResponse> pending, boolean keepAlive) {
        if (pending.isDone()) {
            complete(ctx, method, path, pending, keepAlive);
            return;
        }
        ctx.channel().config().setAutoRead(false);
        pending.whenComplete((response, error) -> ctx.executor().execute(() -> {
            complete(ctx, method, path, pending, keepAlive);
            ctx.channel().config().setAutoRead(true);
        }));
    }

    private void complete(ChannelHandlerContext ctx, HttpMethod method, String path,
            CompletableFuture<ControllerResponse> done, boolean keepAlive) {
        ControllerResponse response;
        try {
            response = done.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            writeFailure(ctx, method, path, cause, keepAlive);
            return;
        }
        write(ctx, response, keepAlive);
    }

    private void writeFailure(ChannelHandlerContext ctx, HttpMethod method, String path, Throwable failure,
            boolean keepAlive) {
        if (failure instanceof GatewayException e) {
            if (e.statusCode() >= 500) {
                log.warn("{} {} failed: {}", method, path, e.getMessage());
            } else {
                log.debug("{} {} rejected ({}): {}", method, path, e.statusCode(), e.getMessage());
            }
            HttpResponses.write(ctx, HttpResponses.build(e), keepAlive);
            return;
        }
        log.error("Handler error: {} {}", method, path, failure);
        String detail = config.production() ? "An unexpected error occurred" : failure.toString();
        write(ctx, ControllerResponse.error(INTERNAL_SERVER_ERROR, "Internal server error", detail), keepAlive);
    }

    private void admit(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!path.startsWith("/api/")) {
            return;
        }
        String clientIp = RequestGuard.clientIp(ctx.channel());
        if (path.startsWith("/api/v1/")) {
            guard.admit(clientIp, req.headers());
        } else {
            guard.checkRate(clientIp);
        }
    }

    private static void write(ChannelHandlerContext ctx, ControllerResponse response, boolean keepAlive) {
        HttpResponses.write(ctx, HttpResponses.build(response), keepAlive);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Unhandled exception in channel {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}

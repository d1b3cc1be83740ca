package netops.gateway.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import netops.gateway.util.Jsons;

import java.util.concurrent.CompletableFuture;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods and signal failures by throwing
 * {@link netops.gateway.error.GatewayException}s, which the router renders.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Handle a request whose answer depends on outbound I/O. The router writes the response when the
     * future completes, so the event loop is never held. The request is released once this returns and
     * must not be read from the future's callbacks.
     */
    default CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        return CompletableFuture.completedFuture(handle(ctx, req, path));
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(Object body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, Object body) {
            String text = body instanceof String s ? s : Jsons.toJson(body);
            return new ControllerResponse(status, "application/json", text);
        }

        public static ControllerResponse error(HttpResponseStatus status, String error, String detail) {
            return json(status, new ErrorResponse(error, detail, status.code()));
        }
    }
}

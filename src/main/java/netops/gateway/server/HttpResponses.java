package netops.gateway.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import netops.gateway.api.Controller.ControllerResponse;
import netops.gateway.api.ErrorResponse;
import netops.gateway.error.GatewayException;
import netops.gateway.error.RateLimitException;

import java.nio.charset.StandardCharsets;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Writes complete responses from the router and the proxy.
 */
public final class HttpResponses {

    private HttpResponses() {
    }

    public static FullHttpResponse build(ControllerResponse response) {
        byte[] bytes = (response.body() == null ? "" : response.body()).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse out = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        out.headers().set(HttpHeaderNames.CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        out.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        return out;
    }

    public static FullHttpResponse build(GatewayException e) {
        FullHttpResponse out = build(ControllerResponse.json(HttpResponseStatus.valueOf(e.statusCode()),
                ErrorResponse.of(e)));
        if (e instanceof RateLimitException limited) {
            out.headers().set(HttpHeaderNames.RETRY_AFTER, limited.retryAfterSeconds());
        }
        return out;
    }

    /**
     * Write the response, closing the connection afterwards unless the client asked for keep-alive.
     */
    public static ChannelFuture write(ChannelHandlerContext ctx, FullHttpResponse response, boolean keepAlive) {
        if (!keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        }
        ChannelFuture future = ctx.writeAndFlush(response);
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
        return future;
    }
}

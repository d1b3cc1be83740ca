package netops.gateway.proxy;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.LastHttpContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend side of a proxied connection: streams response parts back to the client connection.
 * Runs on the same event loop as its {@link ProxyFrontHandler}.
 */
class BackendRelayHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(BackendRelayHandler.class);

    private final ProxyFrontHandler front;

    private boolean awaitingResponse;
    private boolean responseStarted;
    private boolean closeAfterResponse;
    private boolean switching;
    private boolean relaying;

    BackendRelayHandler(ProxyFrontHandler front) {
        this.front = front;
    }

    void expectResponse() {
        awaitingResponse = true;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (relaying) {
            front.writeToClient(msg, false);
            return;
        }

        if (msg instanceof HttpResponse response) {
            int code = response.status().code();
            if (code == HttpResponseStatus.SWITCHING_PROTOCOLS.code()) {
                switching = true;
            } else if (code >= 200) {
                responseStarted = true;
                closeAfterResponse = !HttpUtil.isKeepAlive(response);
            }
        }

        boolean last = msg instanceof LastHttpContent;
        boolean finalResponseDone = last && responseStarted;
        front.writeToClient(msg, finalResponseDone && closeAfterResponse);

        if (last && switching) {
            relaying = true;
            awaitingResponse = false;
            front.switchToRelay(ctx);
        } else if (finalResponseDone) {
            awaitingResponse = false;
            responseStarted = false;
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        front.backendWritabilityChanged(ctx.channel().isWritable());
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        front.backendClosed(ctx.channel(), responseStarted, awaitingResponse && !responseStarted);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Backend connection error: {}", cause.getMessage());
        ctx.close();
    }
}

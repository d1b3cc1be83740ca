package netops.gateway.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import netops.gateway.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-connection WebSocket session. Registers the client with the broadcaster once the handshake
 * completes and removes it when the connection goes away.
 * <p>
 * Client messages: {@code {"type":"subscribe","channels":[...]}} and {@code {"type":"ping"}}.
 */
public class WebSocketSessionHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionHandler.class);

    private final EventBroadcaster broadcaster;
    private boolean registered;

    public WebSocketSessionHandler(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            registered = true;
            broadcaster.register(ctx.channel());
            broadcaster.send(ctx.channel(), "connected", Map.of("message", "Connected to gateway"));
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        JsonNode message;
        try {
            message = Jsons.readTree(frame.text());
        } catch (IllegalArgumentException e) {
            broadcaster.send(ctx.channel(), "error", Map.of("error", "Malformed message"));
            return;
        }
        String type = message == null ? "" : message.path("type").asText("");

        switch (type) {
            case "subscribe" -> {
                List<String> channels = new ArrayList<>();
                message.path("channels").forEach(node -> channels.add(node.asText()));
                Set<String> subscribed = broadcaster.subscribe(ctx.channel(), channels);
                broadcaster.send(ctx.channel(), "subscribed", Map.of("channels", subscribed));
            }
            case "ping" -> broadcaster.send(ctx.channel(), "pong", null);
            default -> {
                log.debug("Unknown WebSocket message type '{}' from {}", type, ctx.channel().remoteAddress());
                broadcaster.send(ctx.channel(), "error", Map.of("error", "Unknown message type: " + type));
            }
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (registered) {
            broadcaster.unregister(ctx.channel());
            registered = false;
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("WebSocket session error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}

package netops.gateway.broadcast;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import netops.gateway.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers {@code {type, data, timestamp}} envelopes to connected WebSocket clients.
 * <p>
 * A client that never subscribed receives every event; after a subscribe it receives only the
 * listed channels. Publishing is serialized and every write is queued on the client's event loop,
 * so each client sees events in publish order.
 * <p>
 * Clients are added and removed only by {@link WebSocketSessionHandler}.
 */
public class EventBroadcaster implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final Map<Channel, Subscription> clients = new ConcurrentHashMap<>();
    private final Clock clock;

    public EventBroadcaster() {
        this(Clock.systemUTC());
    }

    public EventBroadcaster(Clock clock) {
        this.clock = clock;
    }

    void register(Channel channel) {
        clients.put(channel, new Subscription());
        log.info("WebSocket client connected: {} ({} total)", channel.remoteAddress(), clients.size());
    }

    void unregister(Channel channel) {
        if (clients.remove(channel) != null) {
            log.info("WebSocket client disconnected: {} ({} total)", channel.remoteAddress(), clients.size());
        }
    }

    /**
     * Replace the client's channel set.
     *
     * @return the channels now subscribed
     */
    Set<String> subscribe(Channel channel, Collection<String> channels) {
        Subscription subscription = clients.get(channel);
        if (subscription == null) {
            return Set.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : channels) {
            if (name != null && !name.isBlank()) {
                names.add(name.trim());
            }
        }
        subscription.channels = Collections.unmodifiableSet(names);
        log.debug("Client {} subscribed to {}", channel.remoteAddress(), names);
        return subscription.channels;
    }

    @Override
    public synchronized void publish(String channel, String type, Object data) {
        if (clients.isEmpty()) {
            return;
        }
        String json = Jsons.toJson(envelope(type, data));
        for (Map.Entry<Channel, Subscription> entry : clients.entrySet()) {
            Channel client = entry.getKey();
            if (!client.isActive()) {
                unregister(client);
                continue;
            }
            if (!entry.getValue().accepts(channel)) {
                continue;
            }
            if (!client.isWritable()) {
                log.debug("Skipping slow client {} for {}", client.remoteAddress(), type);
                continue;
            }
            write(client, json);
        }
    }

    /**
     * Send one envelope to one client, outside any subscription filter.
     */
    public void send(Channel client, String type, Object data) {
        write(client, Jsons.toJson(envelope(type, data)));
    }

    public int clientCount() {
        return clients.size();
    }

    /** Channels the client subscribed to; null while it is unfiltered or unknown */
    Set<String> subscriptionOf(Channel channel) {
        Subscription subscription = clients.get(channel);
        return subscription == null ? null : subscription.channels;
    }

    private ObjectNode envelope(String type, Object data) {
        ObjectNode envelope = Jsons.object();
        envelope.put("type", type);
        if (data != null) {
            envelope.set("data", Jsons.mapper().valueToTree(data));
        }
        envelope.put("timestamp", clock.instant().toString());
        return envelope;
    }

    private void write(Channel client, String json) {
        client.eventLoop().execute(() -> client.writeAndFlush(new TextWebSocketFrame(json))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.warn("Dropping WebSocket client {}: {}", client.remoteAddress(),
                                future.cause() != null ? future.cause().getMessage() : "write failed");
                        unregister(client);
                        client.close();
                    }
                }));
    }

    private static final class Subscription {
        private volatile Set<String> channels;

        boolean accepts(String channel) {
            Set<String> current = channels;
            return channel == null || current == null || current.contains(channel);
        }
    }
}

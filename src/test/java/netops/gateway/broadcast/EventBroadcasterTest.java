package netops.gateway.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import netops.gateway.support.MutableClock;
import netops.gateway.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventBroadcasterTest {

    private MutableClock clock;
    private EventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        broadcaster = new EventBroadcaster(clock);
    }

    static List<JsonNode> drain(EmbeddedChannel channel) {
        channel.runPendingTasks();
        List<JsonNode> events = new ArrayList<>();
        Object msg;
        while ((msg = channel.readOutbound()) != null) {
            TextWebSocketFrame frame = (TextWebSocketFrame) msg;
            events.add(Jsons.readTree(frame.text()));
            frame.release();
        }
        return events;
    }

    @Test
    void unsubscribedClientReceivesEverything() {
        EmbeddedChannel client = new EmbeddedChannel();
        broadcaster.register(client);

        broadcaster.publish("tasks", "task-update", Map.of("task_id", "t1"));
        broadcaster.publish("health", "health-update", Map.of("grade", "good"));

        List<JsonNode> events = drain(client);
        assertEquals(2, events.size());
        assertEquals("task-update", events.get(0).get("type").asText());
        assertEquals("t1", events.get(0).get("data").get("task_id").asText());
        assertEquals(clock.instant().toString(), events.get(0).get("timestamp").asText());
        assertEquals("health-update", events.get(1).get("type").asText());
    }

    @Test
    void subscriptionFiltersChannels() {
        EmbeddedChannel tasksOnly = new EmbeddedChannel();
        EmbeddedChannel everything = new EmbeddedChannel();
        broadcaster.register(tasksOnly);
        broadcaster.register(everything);

        Set<String> subscribed = broadcaster.subscribe(tasksOnly, List.of("tasks", " ", "tasks"));
        assertEquals(Set.of("tasks"), subscribed);
        assertEquals(Set.of("tasks"), broadcaster.subscriptionOf(tasksOnly));
        assertNull(broadcaster.subscriptionOf(everything));

        broadcaster.publish("alerts", "alert", Map.of("id", "a1"));
        broadcaster.publish("tasks", "task-update", Map.of("task_id", "t1"));
        broadcaster.publish(null, "shutdown", null);

        List<JsonNode> filtered = drain(tasksOnly);
        assertEquals(List.of("task-update", "shutdown"), filtered.stream().map(e -> e.get("type").asText()).toList());
        assertFalse(filtered.get(1).has("data"));
        assertEquals(3, drain(everything).size());
    }

    @Test
    void preservesPublishOrder() {
        EmbeddedChannel client = new EmbeddedChannel();
        broadcaster.register(client);

        for (int i = 0; i < 20; i++) {
            broadcaster.publish("tasks", "task-update", Map.of("n", i));
        }

        List<JsonNode> events = drain(client);
        assertEquals(20, events.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, events.get(i).get("data").get("n").asInt());
        }
    }

    @Test
    void closedClientsAreDropped() {
        EmbeddedChannel client = new EmbeddedChannel();
        broadcaster.register(client);
        assertEquals(1, broadcaster.clientCount());

        client.close();
        broadcaster.publish("tasks", "task-update", Map.of());

        assertEquals(0, broadcaster.clientCount());
    }

    @Test
    void sendBypassesSubscription() {
        EmbeddedChannel client = new EmbeddedChannel();
        broadcaster.register(client);
        broadcaster.subscribe(client, List.of("alerts"));

        broadcaster.send(client, "pong", null);

        assertEquals("pong", drain(client).get(0).get("type").asText());
    }

    @Test
    void subscribeUnknownClientIsNoop() {
        assertTrue(broadcaster.subscribe(new EmbeddedChannel(), List.of("tasks")).isEmpty());
        broadcaster.publish("tasks", "task-update", Map.of());
        assertEquals(0, broadcaster.clientCount());
    }
}

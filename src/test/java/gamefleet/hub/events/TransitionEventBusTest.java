package gamefleet.hub.events;

import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.model.TransitionEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class TransitionEventBusTest {

    private static TransitionEvent event(String spokeId, SpokeStatus to) {
        return new TransitionEvent(spokeId, spokeId.toUpperCase(), SpokeStatus.ONLINE, to, Instant.now());
    }

    @Test
    void deliversInOrderToEveryListener() {
        List<TransitionEvent> first = new CopyOnWriteArrayList<>();
        List<TransitionEvent> second = new CopyOnWriteArrayList<>();
        try (TransitionEventBus bus = new TransitionEventBus(16)) {
            bus.subscribe(first::add);
            bus.subscribe(second::add);
            bus.start();

            bus.publish(event("s1", SpokeStatus.DEGRADED));
            bus.publish(event("s1", SpokeStatus.OFFLINE));

            await().atMost(Duration.ofSeconds(5)).until(() -> second.size() == 2);
            assertEquals(SpokeStatus.DEGRADED, first.get(0).to());
            assertEquals(SpokeStatus.OFFLINE, first.get(1).to());
        }
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<TransitionEvent> received = new CopyOnWriteArrayList<>();
        try (TransitionEventBus bus = new TransitionEventBus(16)) {
            bus.subscribe(e -> {
                throw new IllegalStateException("webhook down");
            });
            bus.subscribe(received::add);
            bus.start();

            bus.publish(event("s1", SpokeStatus.DEGRADED));
            bus.publish(event("s2", SpokeStatus.DEGRADED));

            await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 2);
        }
    }

    @Test
    void fullQueueDropsWithoutBlocking() {
        List<TransitionEvent> received = new CopyOnWriteArrayList<>();
        TransitionEventBus bus = new TransitionEventBus(2);
        bus.subscribe(received::add);

        assertTrue(bus.publish(event("s1", SpokeStatus.DEGRADED)));
        assertTrue(bus.publish(event("s2", SpokeStatus.DEGRADED)));
        assertFalse(bus.publish(event("s3", SpokeStatus.DEGRADED)));
        assertEquals(1, bus.droppedCount());

        bus.close();
        assertEquals(List.of("s1", "s2"), received.stream().map(TransitionEvent::spokeId).toList());
    }
}

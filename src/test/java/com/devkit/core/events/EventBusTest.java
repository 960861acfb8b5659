package com.devkit.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    @DisplayName("DevkitEvent.of stamps the current time")
    void eventFactory() {
        var event = DevkitEvent.of("task.started", "PROJ-1", "PROJ-2", Map.of("attempt", 1));

        assertEquals("task.started", event.eventType());
        assertEquals("PROJ-1", event.runId());
        assertEquals("PROJ-2", event.taskId());
        assertEquals(Map.of("attempt", 1), event.payload());
        assertNotNull(event.timestamp());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublish {

        @Test
        @DisplayName("delivers only events of the subscribed run")
        void runScoped() {
            List<DevkitEvent> received = new ArrayList<>();
            eventBus.subscribe("PROJ-1", received::add);

            eventBus.publish(DevkitEvent.of("task.started", "PROJ-1", "A", Map.of()));
            eventBus.publish(DevkitEvent.of("task.started", "PROJ-9", "B", Map.of()));

            assertEquals(1, received.size());
            assertEquals("A", received.get(0).taskId());
        }

        @Test
        @DisplayName("global subscribers receive every event")
        void global() {
            List<DevkitEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(DevkitEvent.of("run.started", "PROJ-1", null, Map.of()));
            eventBus.publish(DevkitEvent.of("run.started", "PROJ-2", null, Map.of()));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<DevkitEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe("PROJ-1", received::add);
            var global = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            global.unsubscribe();
            eventBus.publish(DevkitEvent.of("run.started", "PROJ-1", null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a throwing subscriber does not affect the others")
        void faultIsolation() {
            List<DevkitEvent> received = new ArrayList<>();
            eventBus.subscribe("PROJ-1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("PROJ-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(DevkitEvent.of("task.completed", "PROJ-1", "A", Map.of())));
            assertEquals(1, received.size());
        }
    }
}

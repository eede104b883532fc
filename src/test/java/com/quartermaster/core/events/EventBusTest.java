package com.quartermaster.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

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

    private static OrchestrationEvent event(String type, String taskId) {
        return OrchestrationEvent.of(type, taskId, Map.of());
    }

    // -- OrchestrationEvent record tests --------------------------------------

    @Nested
    @DisplayName("OrchestrationEvent")
    class OrchestrationEventTests {

        @Test
        @DisplayName("creates event with all fields")
        void createsEventWithAllFields() {
            Instant now = Instant.now();
            var event = new OrchestrationEvent(OrchestrationEvent.AGENT_SPAWNED, "T001", Map.of("pid", 42L), now);

            assertEquals("agent:spawned", event.eventType());
            assertEquals("T001", event.taskId());
            assertEquals(Map.of("pid", 42L), event.payload());
            assertEquals(now, event.timestamp());
        }

        @Test
        @DisplayName("payload is copied and null becomes empty")
        void payloadCopied() {
            Map<String, Object> payload = new HashMap<>();
            payload.put("line", "hello");
            var event = OrchestrationEvent.of(OrchestrationEvent.AGENT_LOG, "T001", payload);
            payload.put("line", "changed");

            assertEquals("hello", event.payload().get("line"));
            assertEquals(Map.of(), new OrchestrationEvent("x", null, null, Instant.now()).payload());
        }
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to task subscriber")
        void deliversEventToTaskSubscriber() {
            List<OrchestrationEvent> received = new ArrayList<>();
            eventBus.subscribe("T001", received::add);

            var event = event(OrchestrationEvent.AGENT_SPAWNED, "T001");
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different task")
        void doesNotDeliverToDifferentTask() {
            List<OrchestrationEvent> received = new ArrayList<>();
            eventBus.subscribe("T002", received::add);

            eventBus.publish(event(OrchestrationEvent.AGENT_SPAWNED, "T001"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void deliversMultipleEventsInOrder() {
            List<OrchestrationEvent> received = new ArrayList<>();
            eventBus.subscribe("T001", received::add);

            eventBus.publish(event(OrchestrationEvent.AGENT_SPAWNED, "T001"));
            eventBus.publish(event(OrchestrationEvent.AGENT_COMPLETED, "T001"));
            eventBus.publish(event(OrchestrationEvent.AGENT_REAPED, "T001"));

            assertEquals(List.of("agent:spawned", "agent:completed", "agent:reaped"),
                    received.stream().map(OrchestrationEvent::eventType).toList());
        }
    }

    // -- Global subscription tests --------------------------------------------

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global subscriber receives events from all tasks, including task-less ones")
        void globalSubscriberReceivesAllEvents() {
            List<OrchestrationEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(OrchestrationEvent.TASK_UPDATED, "T001"));
            eventBus.publish(event(OrchestrationEvent.TASK_UPDATED, "T002"));
            eventBus.publish(event(OrchestrationEvent.TASK_UPDATED, null));

            assertEquals(3, received.size());
        }

        @Test
        @DisplayName("global and task-specific subscribers both receive the event")
        void globalAndTaskSpecificBothReceive() {
            List<OrchestrationEvent> globalReceived = new ArrayList<>();
            List<OrchestrationEvent> taskReceived = new ArrayList<>();
            eventBus.subscribeAll(globalReceived::add);
            eventBus.subscribe("T001", taskReceived::add);

            eventBus.publish(event(OrchestrationEvent.AGENT_KILLED, "T001"));

            assertEquals(1, globalReceived.size());
            assertEquals(1, taskReceived.size());
        }
    }

    // -- Unsubscribe tests ----------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<OrchestrationEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("T001", received::add);

            eventBus.publish(event(OrchestrationEvent.AGENT_LOG, "T001"));
            subscription.unsubscribe();
            eventBus.publish(event(OrchestrationEvent.AGENT_LOG, "T001"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing global subscription stops delivery")
        void unsubscribeGlobalStopsDelivery() {
            List<OrchestrationEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(event(OrchestrationEvent.AGENT_LOG, "T001"));

            assertTrue(received.isEmpty());
        }
    }

    // -- Concurrency tests ----------------------------------------------------

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("handles concurrent publishes safely")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<OrchestrationEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("T001", received::add);

            int threadCount = 10;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);

            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event(OrchestrationEvent.AGENT_LOG, "T001"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }
    }

    // -- Edge cases -----------------------------------------------------------

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("publishing with no subscribers does not throw")
        void publishWithNoSubscribersDoesNotThrow() {
            assertDoesNotThrow(() -> eventBus.publish(event(OrchestrationEvent.AGENT_REAPED, "T001")));
        }

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void subscriberExceptionDoesNotPreventOthers() {
            List<OrchestrationEvent> received = new ArrayList<>();
            eventBus.subscribe("T001", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("T001", received::add);

            eventBus.publish(event(OrchestrationEvent.AGENT_SPAWNED, "T001"));

            assertEquals(1, received.size());
        }
    }
}

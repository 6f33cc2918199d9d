package com.aejis.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
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

    @Nested
    @DisplayName("AejisEvent")
    class AejisEventTests {

        @Test
        @DisplayName("of() fills timestamp and defaults payload")
        void ofFillsDefaults() {
            var event = AejisEvent.of("pool.degraded", null, null, null);

            assertEquals("pool.degraded", event.eventType());
            assertNull(event.jobId());
            assertEquals(Map.of(), event.payload());
            assertNotNull(event.timestamp());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to job subscriber")
        void deliversToJobSubscriber() {
            List<AejisEvent> received = new ArrayList<>();
            eventBus.subscribe("JOB-1", received::add);

            eventBus.publish(AejisEvent.of("job.submitted", "JOB-1", null, Map.of()));

            assertEquals(1, received.size());
            assertEquals("job.submitted", received.get(0).eventType());
        }

        @Test
        @DisplayName("does not deliver another job's events")
        void isolatesJobs() {
            List<AejisEvent> received = new ArrayList<>();
            eventBus.subscribe("JOB-1", received::add);

            eventBus.publish(AejisEvent.of("job.submitted", "JOB-2", null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives job and pool events")
        void globalReceivesAll() {
            List<AejisEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(AejisEvent.of("job.completed", "JOB-1", "c1", Map.of()));
            eventBus.publish(AejisEvent.of("pool.degraded", null, null, Map.of("mode", "EPHEMERAL_ONLY")));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribeStopsDelivery() {
            List<AejisEvent> received = new ArrayList<>();
            EventBus.Subscription sub = eventBus.subscribe("JOB-1", received::add);
            sub.unsubscribe();

            eventBus.publish(AejisEvent.of("job.submitted", "JOB-1", null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a throwing subscriber does not break delivery to others")
        void throwingSubscriberIsolated() {
            List<AejisEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> { throw new IllegalStateException("boom"); });
            eventBus.subscribeAll(received::add);

            eventBus.publish(AejisEvent.of("job.failed", "JOB-1", null, Map.of()));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("concurrent publishers deliver every event")
        void concurrentPublish() throws InterruptedException {
            List<AejisEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            var done = new CountDownLatch(100);
            for (int i = 0; i < 100; i++) {
                String jobId = "JOB-" + i;
                pool.submit(() -> {
                    eventBus.publish(AejisEvent.of("job.submitted", jobId, null, Map.of()));
                    done.countDown();
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
            pool.shutdown();
            assertEquals(100, received.size());
        }
    }
}

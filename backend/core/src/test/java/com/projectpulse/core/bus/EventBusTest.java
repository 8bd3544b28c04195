package com.projectpulse.core.bus;

import com.projectpulse.core.events.CollectorTickStarted;
import com.projectpulse.core.events.CycleStarted;
import com.projectpulse.core.events.Event;
import com.projectpulse.core.model.CycleType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Test
    void publishRoutesToSubscribersOfTheEventType() {
        EventBus bus = new EventBus();
        AtomicInteger tickHits = new AtomicInteger();
        AtomicInteger cycleHits = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> tickHits.incrementAndGet());
        bus.subscribe(CycleStarted.class, event -> cycleHits.incrementAndGet());

        bus.publish(new CollectorTickStarted(NOW, "chatCollector", NOW.minusSeconds(3600)));
        bus.publish(new CycleStarted(NOW, CycleType.DAILY));
        bus.publish(new CycleStarted(NOW, CycleType.WEEKLY));

        assertEquals(1, tickHits.get());
        assertEquals(2, cycleHits.get());
    }

    @Test
    void wildcardSubscriberSeesEveryEvent() {
        EventBus bus = new EventBus();
        List<Event> seen = new ArrayList<>();
        bus.subscribeAll(seen::add);

        bus.publish(new CollectorTickStarted(NOW, "chatCollector", null));
        bus.publish(new CycleStarted(NOW, CycleType.DAILY));

        assertEquals(List.of("CollectorTickStarted", "CycleStarted"), seen.stream().map(Event::type).toList());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(CycleStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(CycleStarted.class, event -> safeHits.incrementAndGet());
        bus.subscribeAll(event -> safeHits.incrementAndGet());

        bus.publish(new CycleStarted(NOW, CycleType.WEEKLY));

        assertEquals(2, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }

    @Test
    void concurrentPublishInvokesAllSubscribers() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("No handler should fail in this test", error);
        });
        int subscriberCount = 8;
        int publishCount = 1_000;
        LongAdder invocations = new LongAdder();
        for (int i = 0; i < subscriberCount; i++) {
            bus.subscribe(CycleStarted.class, event -> invocations.increment());
        }

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < publishCount; i++) {
                futures.add(executor.submit(() -> bus.publish(new CycleStarted(Instant.now(), CycleType.DAILY))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }

        assertEquals((long) subscriberCount * publishCount, invocations.sum());
    }
}

package com.roundabout.core.governor;

import com.roundabout.core.events.AgentEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private GovernorFixture fixture;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        fixture = new GovernorFixture();
        breaker = fixture.breaker;
    }

    @Test
    @DisplayName("starts closed")
    void startsClosed() {
        assertEquals(CircuitBreakerStatus.CLOSED, breaker.status());
        var info = breaker.info(0.0, 0.0);
        assertNull(info.lastTriggered());
        assertNull(info.nextRetryAt());
    }

    @Test
    @DisplayName("tryOpen reports the transition exactly once")
    void tryOpenOnlyOnce() {
        assertTrue(breaker.tryOpen("first"));
        assertFalse(breaker.tryOpen("second"));
        assertEquals(CircuitBreakerStatus.OPEN, breaker.status());
        assertEquals(1, fixture.time.pendingTasks());
    }

    @Test
    @DisplayName("threads racing to open report exactly one winner and announce once")
    void concurrentTryOpenHasOneWinner() throws Exception {
        List<AgentEvent> opened = new CopyOnWriteArrayList<>();
        fixture.eventBus.subscribeAll(e -> {
            if (e.eventType().equals("governor.breaker.open")) {
                opened.add(e);
            }
        });
        int threads = 16;
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    start.await();
                    if (breaker.tryOpen("race")) {
                        winners.incrementAndGet();
                    }
                    return null;
                }));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, winners.get());
        assertEquals(1, opened.size());
        assertEquals(1, fixture.time.pendingTasks());
        assertEquals(1.0, fixture.registry.get("roundabout.breaker.transitions")
                .tag("from", "CLOSED").tag("to", "OPEN").counter().count());
    }

    @Test
    @DisplayName("open breaker records trigger and retry instants one window apart")
    void openRecordsInstants() {
        breaker.tryOpen("test");
        var info = breaker.info(0.5, 1.0);
        assertEquals(fixture.time.instant(), info.lastTriggered());
        assertEquals(fixture.time.instant().plus(Duration.ofMinutes(5)), info.nextRetryAt());
        assertEquals(0.5, info.errorRate());
    }

    @Test
    @DisplayName("cooldown moves OPEN to HALF_OPEN, not before")
    void cooldownMovesToHalfOpen() {
        breaker.tryOpen("test");
        fixture.time.advance(Duration.ofMinutes(4));
        assertEquals(CircuitBreakerStatus.OPEN, breaker.status());
        fixture.time.advance(Duration.ofMinutes(1));
        assertEquals(CircuitBreakerStatus.HALF_OPEN, breaker.status());
    }

    @Test
    @DisplayName("three consecutive probe successes close a half-open breaker")
    void probesClose() {
        breaker.tryOpen("test");
        fixture.time.advance(Duration.ofMinutes(5));

        breaker.recordProbeSuccess();
        breaker.recordProbeSuccess();
        assertEquals(CircuitBreakerStatus.HALF_OPEN, breaker.status());
        breaker.recordProbeSuccess();
        assertEquals(CircuitBreakerStatus.CLOSED, breaker.status());
    }

    @Test
    @DisplayName("probe successes are ignored while closed or open")
    void probesIgnoredOutsideHalfOpen() {
        breaker.recordProbeSuccess();
        assertEquals(CircuitBreakerStatus.CLOSED, breaker.status());
        breaker.tryOpen("test");
        breaker.recordProbeSuccess();
        assertEquals(CircuitBreakerStatus.OPEN, breaker.status());
    }

    @Test
    @DisplayName("re-opening from half-open restarts the cooldown")
    void reopenFromHalfOpen() {
        breaker.tryOpen("test");
        fixture.time.advance(Duration.ofMinutes(5));
        assertTrue(breaker.tryOpen("error while half-open"));
        assertEquals(CircuitBreakerStatus.OPEN, breaker.status());
        fixture.time.advance(Duration.ofMinutes(5));
        assertEquals(CircuitBreakerStatus.HALF_OPEN, breaker.status());
    }

    @Test
    @DisplayName("forcing CLOSED cancels the pending cooldown")
    void forceClosedCancelsCooldown() {
        breaker.tryOpen("test");
        breaker.force(CircuitBreakerStatus.CLOSED);
        assertEquals(0, fixture.time.pendingTasks());
        fixture.time.advance(Duration.ofMinutes(10));
        assertEquals(CircuitBreakerStatus.CLOSED, breaker.status());
    }

    @Test
    @DisplayName("transitions are published and counted")
    void transitionsPublished() {
        List<AgentEvent> events = new ArrayList<>();
        fixture.eventBus.subscribeAll(events::add);

        breaker.tryOpen("test");
        fixture.time.advance(Duration.ofMinutes(5));

        assertEquals(List.of("governor.breaker.open", "governor.breaker.half_open"),
                events.stream().map(AgentEvent::eventType).toList());
        var counter = fixture.registry.find("roundabout.breaker.transitions")
                .tag("from", "CLOSED").tag("to", "OPEN").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}

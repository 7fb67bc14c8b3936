package com.roundabout.core.governor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Time-bounded sample buffer. Samples older than the window (timestamp at or
 * before {@code now - window}) are pruned on every access. All operations
 * serialize on the window's own monitor.
 */
class SlidingWindow<T> {

    record Sample<T>(Instant timestamp, T value) {
    }

    private final Deque<Sample<T>> samples = new ArrayDeque<>();
    private final Duration window;
    private final Clock clock;

    SlidingWindow(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    synchronized List<T> add(T value) {
        Instant now = clock.instant();
        samples.addLast(new Sample<>(now, value));
        prune(now);
        return values();
    }

    synchronized List<T> snapshot() {
        prune(clock.instant());
        return values();
    }

    synchronized int size() {
        prune(clock.instant());
        return samples.size();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!samples.isEmpty() && !samples.peekFirst().timestamp().isAfter(cutoff)) {
            samples.removeFirst();
        }
    }

    private List<T> values() {
        return samples.stream().map(Sample::value).toList();
    }
}

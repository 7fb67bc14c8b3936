package com.roundabout.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for agent and governor events.
 * <p>
 * Supports per-agent subscriptions and global subscriptions that receive all events.
 * Keeps a bounded buffer of the most recent events for status reporting.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int RECENT_CAPACITY = 200;

    /** Per-agent subscribers keyed by agentId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AgentEvent>>> agentSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<AgentEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Deque<AgentEvent> recent = new ArrayDeque<>();

    /**
     * Publish an event to all matching subscribers (agent-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(AgentEvent event) {
        log.debug("Publishing event: {} for agent {}", event.eventType(), event.agentId());

        synchronized (recent) {
            if (recent.size() == RECENT_CAPACITY) {
                recent.removeFirst();
            }
            recent.addLast(event);
        }

        if (event.agentId() != null) {
            List<Consumer<AgentEvent>> agentSubs = agentSubscribers.get(event.agentId());
            if (agentSubs != null) {
                for (Consumer<AgentEvent> subscriber : agentSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<AgentEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific agent.
     *
     * @param agentId  the agent to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String agentId, Consumer<AgentEvent> consumer) {
        agentSubscribers.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to agent {}", agentId);
        return () -> {
            CopyOnWriteArrayList<Consumer<AgentEvent>> subs = agentSubscribers.get(agentId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all agents and the governor.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<AgentEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Most recent events, oldest first, at most {@code limit} of them.
     */
    public List<AgentEvent> recentEvents(int limit) {
        synchronized (recent) {
            int skip = Math.max(0, recent.size() - limit);
            return recent.stream().skip(skip).toList();
        }
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AgentEvent> subscriber, AgentEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}

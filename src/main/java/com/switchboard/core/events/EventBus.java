package com.switchboard.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for scheduler and tool manager events.
 * <p>
 * Supports per-scope subscriptions (a plan id, or the tools scope) and global
 * subscriptions. Safe for publishing from worker-pool threads.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SwitchboardEvent>>> scopeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SwitchboardEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(SwitchboardEvent event) {
        log.debug("Publishing event: {} for scope {}", event.eventType(), event.scope());

        List<Consumer<SwitchboardEvent>> subs = scopeSubscribers.get(event.scope());
        if (subs != null) {
            for (Consumer<SwitchboardEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<SwitchboardEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one scope.
     *
     * @param scope    a plan id, or {@link SwitchboardEvent#TOOLS_SCOPE}
     * @param consumer callback invoked for each event
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String scope, Consumer<SwitchboardEvent> consumer) {
        scopeSubscribers.computeIfAbsent(scope, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to scope {}", scope);
        return () -> {
            CopyOnWriteArrayList<Consumer<SwitchboardEvent>> subs = scopeSubscribers.get(scope);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<SwitchboardEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SwitchboardEvent> subscriber, SwitchboardEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}

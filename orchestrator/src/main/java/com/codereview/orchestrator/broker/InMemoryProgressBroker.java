package com.codereview.orchestrator.broker;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * In-process {@link ProgressBroker}.
 *
 * <p>The registry (task id → client id → subscriber) is a plain map guarded
 * by a single lock that is held only for structural changes and for taking
 * a snapshot of a task's subscribers. Delivery runs outside that lock, so a
 * slow connection on one task never stalls register/unregister/broadcast on
 * another.
 *
 * <p>Writes to a single subscriber are serialized on that subscriber, so the
 * transport never sees two concurrent sends on one connection.
 *
 * <pre>
 *   codereview.broker.deliveries{outcome="success|failure"}
 *   codereview.broker.evictions
 *   codereview.broker.subscribers
 * </pre>
 */
public class InMemoryProgressBroker implements ProgressBroker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProgressBroker.class);

    private final Object registryLock = new Object();
    private final Map<UUID, Map<String, Subscriber>> buckets = new HashMap<>();

    private final Clock   clock;
    private final Counter delivered;
    private final Counter deliveryFailures;
    private final Counter evictions;

    public InMemoryProgressBroker(Clock clock, MeterRegistry meterRegistry) {
        this.clock            = clock;
        this.delivered        = meterRegistry.counter("codereview.broker.deliveries", "outcome", "success");
        this.deliveryFailures = meterRegistry.counter("codereview.broker.deliveries", "outcome", "failure");
        this.evictions        = meterRegistry.counter("codereview.broker.evictions");
        Gauge.builder("codereview.broker.subscribers", this, InMemoryProgressBroker::totalSubscribers)
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Membership
    // ------------------------------------------------------------------

    @Override
    public void register(UUID taskId, String clientId, MessageSink sink) {
        Subscriber subscriber = new Subscriber(taskId, clientId, sink, clock.instant());
        Subscriber replaced;
        synchronized (registryLock) {
            replaced = buckets.computeIfAbsent(taskId, k -> new LinkedHashMap<>())
                    .put(clientId, subscriber);
        }
        if (replaced != null) {
            log.info("Client {} re-registered on task {}, replacing previous connection", clientId, taskId);
            closeSink(replaced);
        } else {
            log.info("Client {} subscribed to task {}", clientId, taskId);
        }
    }

    @Override
    public void unregister(UUID taskId, String clientId) {
        boolean removed;
        synchronized (registryLock) {
            Map<String, Subscriber> bucket = buckets.get(taskId);
            if (bucket == null) return;
            removed = bucket.remove(clientId) != null;
            if (bucket.isEmpty()) {
                buckets.remove(taskId);
            }
        }
        if (removed) {
            log.info("Client {} unsubscribed from task {}", clientId, taskId);
        }
    }

    @Override
    public boolean touch(UUID taskId, String clientId) {
        synchronized (registryLock) {
            Map<String, Subscriber> bucket = buckets.get(taskId);
            Subscriber subscriber = bucket == null ? null : bucket.get(clientId);
            if (subscriber == null) return false;
            subscriber.lastActive = clock.instant();
            return true;
        }
    }

    // ------------------------------------------------------------------
    // Delivery
    // ------------------------------------------------------------------

    @Override
    public void broadcast(UUID taskId, ProgressEvent event) {
        List<Subscriber> targets;
        synchronized (registryLock) {
            Map<String, Subscriber> bucket = buckets.get(taskId);
            if (bucket == null) {
                log.debug("No subscribers for task {}, dropping {} event", taskId, event.eventType().wireName());
                return;
            }
            targets = List.copyOf(bucket.values());
        }

        int ok = 0;
        for (Subscriber subscriber : targets) {
            if (deliver(subscriber, event)) {
                ok++;
            } else {
                drop(subscriber);
            }
        }
        log.debug("Broadcast {} for task {} reached {}/{} subscriber(s)",
                event.eventType().wireName(), taskId, ok, targets.size());
    }

    private boolean deliver(Subscriber subscriber, ProgressEvent event) {
        try {
            synchronized (subscriber) {
                subscriber.sink.send(event);
            }
            subscriber.lastActive = clock.instant();
            delivered.increment();
            return true;
        } catch (Exception e) {
            deliveryFailures.increment();
            log.warn("Delivery to client {} on task {} failed, dropping subscriber: {}",
                    subscriber.clientId, subscriber.taskId, e.getMessage());
            return false;
        }
    }

    /** Remove this exact subscriber instance; a newer registration under the same id is left alone. */
    private void drop(Subscriber subscriber) {
        boolean removed;
        synchronized (registryLock) {
            Map<String, Subscriber> bucket = buckets.get(subscriber.taskId);
            removed = bucket != null && bucket.remove(subscriber.clientId, subscriber);
            if (bucket != null && bucket.isEmpty()) {
                buckets.remove(subscriber.taskId);
            }
        }
        if (removed) {
            closeSink(subscriber);
        }
    }

    // ------------------------------------------------------------------
    // Idle eviction
    // ------------------------------------------------------------------

    @Override
    public int evictIdle(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<Subscriber> evicted = new ArrayList<>();

        synchronized (registryLock) {
            Iterator<Map<String, Subscriber>> buckIt = buckets.values().iterator();
            while (buckIt.hasNext()) {
                Map<String, Subscriber> bucket = buckIt.next();
                Iterator<Subscriber> subIt = bucket.values().iterator();
                while (subIt.hasNext()) {
                    Subscriber subscriber = subIt.next();
                    if (subscriber.lastActive.isBefore(cutoff)) {
                        subIt.remove();
                        evicted.add(subscriber);
                    }
                }
                if (bucket.isEmpty()) {
                    buckIt.remove();
                }
            }
        }

        for (Subscriber subscriber : evicted) {
            log.info("Evicted idle client {} on task {} (last active {})",
                    subscriber.clientId, subscriber.taskId, subscriber.lastActive);
            closeSink(subscriber);
        }
        evictions.increment(evicted.size());
        return evicted.size();
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    @Override
    public int subscriberCount(UUID taskId) {
        synchronized (registryLock) {
            Map<String, Subscriber> bucket = buckets.get(taskId);
            return bucket == null ? 0 : bucket.size();
        }
    }

    @Override
    public int totalSubscribers() {
        synchronized (registryLock) {
            return buckets.values().stream().mapToInt(Map::size).sum();
        }
    }

    @Override
    public Set<UUID> connectedTasks() {
        synchronized (registryLock) {
            return Set.copyOf(buckets.keySet());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Ask the transport to close a connection the broker no longer tracks. */
    private void closeSink(Subscriber subscriber) {
        try {
            subscriber.sink.close();
        } catch (Exception e) {
            log.debug("Closing connection for client {} on task {} failed: {}",
                    subscriber.clientId, subscriber.taskId, e.getMessage());
        }
    }

    private static final class Subscriber {
        final UUID        taskId;
        final String      clientId;
        final MessageSink sink;
        volatile Instant  lastActive;

        Subscriber(UUID taskId, String clientId, MessageSink sink, Instant registeredAt) {
            this.taskId     = taskId;
            this.clientId   = clientId;
            this.sink       = sink;
            this.lastActive = registeredAt;
        }
    }
}

package com.codereview.orchestrator.broker;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

/**
 * Per-task publish/subscribe hub for live progress.
 *
 * Delivery is best effort: a subscriber that registers while a broadcast
 * is in flight may miss that one event but receives every later one, and
 * a subscriber whose delivery fails is dropped rather than retried.
 */
public interface ProgressBroker {

    /** Attach a subscriber to a task. Re-registering a client id replaces the old entry. */
    void register(UUID taskId, String clientId, MessageSink sink);

    /** Detach a subscriber. Unknown ids are ignored. */
    void unregister(UUID taskId, String clientId);

    /**
     * Record a heartbeat for a subscriber.
     *
     * @return false if the subscriber is not registered (e.g. already evicted)
     */
    boolean touch(UUID taskId, String clientId);

    /** Deliver an event to every current subscriber of the task. Never throws. */
    void broadcast(UUID taskId, ProgressEvent event);

    /**
     * Drop every subscriber whose last activity is older than {@code timeout}.
     *
     * @return number of subscribers removed
     */
    int evictIdle(Duration timeout);

    int subscriberCount(UUID taskId);

    int totalSubscribers();

    Set<UUID> connectedTasks();
}

package com.codereview.orchestrator.service;

import com.codereview.orchestrator.broker.ProgressBroker;
import com.codereview.orchestrator.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic housekeeping that runs independently of task traffic.
 *
 *   - Idle sweep: drops subscribers that have neither received an event nor
 *     sent a heartbeat within the idle timeout.
 *   - Retention sweep: keeps at most {@code retention.capacity} tasks,
 *     discarding the oldest finished ones first.
 */
@Component
@EnableScheduling
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ProgressBroker broker;
    private final TaskStore      store;
    private final Duration       idleTimeout;
    private final int            retentionCapacity;

    public MaintenanceScheduler(ProgressBroker broker,
                                TaskStore store,
                                @Value("${codereview.broker.idle-timeout:90s}") Duration idleTimeout,
                                @Value("${codereview.retention.capacity:100}") int retentionCapacity) {
        this.broker            = broker;
        this.store             = store;
        this.idleTimeout       = idleTimeout;
        this.retentionCapacity = retentionCapacity;
    }

    @Scheduled(fixedDelayString = "${codereview.broker.sweep-interval-ms:30000}")
    public void evictIdleSubscribers() {
        int evicted = broker.evictIdle(idleTimeout);
        if (evicted > 0) {
            log.info("Idle sweep removed {} subscriber(s), {} remain", evicted, broker.totalSubscribers());
        }
    }

    @Scheduled(fixedDelayString = "${codereview.retention.sweep-interval-ms:300000}")
    public void enforceRetention() {
        int removed = store.evictOldest(retentionCapacity);
        if (removed > 0) {
            log.info("Retention sweep removed {} task(s), {} remain", removed, store.count());
        }
    }
}

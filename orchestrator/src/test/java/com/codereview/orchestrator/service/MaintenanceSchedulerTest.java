package com.codereview.orchestrator.service;

import com.codereview.orchestrator.broker.ProgressBroker;
import com.codereview.orchestrator.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

    @Mock ProgressBroker broker;
    @Mock TaskStore      store;

    MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new MaintenanceScheduler(broker, store, Duration.ofSeconds(90), 100);
    }

    @Test
    void evictIdleSubscribers_usesConfiguredTimeout() {
        when(broker.evictIdle(Duration.ofSeconds(90))).thenReturn(2);
        when(broker.totalSubscribers()).thenReturn(5);

        scheduler.evictIdleSubscribers();

        verify(broker).evictIdle(Duration.ofSeconds(90));
    }

    @Test
    void enforceRetention_usesConfiguredCapacity() {
        when(store.evictOldest(100)).thenReturn(0);

        scheduler.enforceRetention();

        verify(store).evictOldest(100);
    }
}

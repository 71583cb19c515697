package com.codereview.orchestrator.config;

import com.codereview.orchestrator.broker.InMemoryProgressBroker;
import com.codereview.orchestrator.broker.ProgressBroker;
import com.codereview.orchestrator.store.InMemoryTaskStore;
import com.codereview.orchestrator.store.TaskStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composition root for the core: one store, one broker and one task
 * executor per process, handed to everything else by injection.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaskStore taskStore(Clock clock) {
        return new InMemoryTaskStore(clock);
    }

    @Bean
    public ProgressBroker progressBroker(Clock clock, MeterRegistry meterRegistry) {
        return new InMemoryProgressBroker(clock, meterRegistry);
    }

    /** One daemon thread per running review. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService reviewTaskExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "review-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}

package com.archflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for design pipeline runs.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String status) {
        Counter.builder("archflow.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordNodeDuration(String nodeId, long ms) {
        Timer.builder("archflow.node.duration")
                .tag("node", nodeId)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementNodeRetries(String nodeId) {
        Counter.builder("archflow.node.retries")
                .tag("node", nodeId)
                .register(registry)
                .increment();
    }

    /**
     * Counts temporary clients handed out because a role's pool was exhausted.
     */
    public void incrementTemporaryClients(String role) {
        Counter.builder("archflow.pool.temporary_clients")
                .description("Unpooled clients created on pool exhaustion")
                .tag("role", role)
                .register(registry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("archflow.cache.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordRevisions(int count) {
        DistributionSummary.builder("archflow.revisions")
                .description("Revision passes per finished run")
                .register(registry)
                .record(count);
    }

    /**
     * Counts callers that attached to an already running execution for the same fingerprint.
     */
    public void incrementSingleFlightAttached() {
        Counter.builder("archflow.singleflight.attached")
                .register(registry)
                .increment();
    }
}

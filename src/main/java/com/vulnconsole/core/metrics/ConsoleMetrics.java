package com.vulnconsole.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for catalog reconciliation and environment operations.
 */
@Service
public class ConsoleMetrics {

    private final MeterRegistry registry;

    public ConsoleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a full rescan.
     *
     * @param reason "forced", "cold", "fingerprint" or "expired"
     */
    public void recordRescan(String reason, long ms) {
        Counter.builder("vulnconsole.catalog.rescans")
                .description("Full catalog rescans by trigger")
                .tag("reason", reason)
                .register(registry)
                .increment();
        Timer.builder("vulnconsole.catalog.scan.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFastPath() {
        Counter.builder("vulnconsole.catalog.fast_path")
                .description("Listings served from the cache without a rescan")
                .register(registry)
                .increment();
    }

    /**
     * @param operation "start", "stop" or "pull"
     * @param outcome   lower-cased {@code OperationResult.Kind}
     */
    public void recordOperation(String operation, String outcome) {
        Counter.builder("vulnconsole.operations.total")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPullDuration(long ms) {
        Timer.builder("vulnconsole.pull.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}

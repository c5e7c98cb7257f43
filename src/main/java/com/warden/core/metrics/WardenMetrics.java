package com.warden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for sidecar supervision.
 */
@Service
public class WardenMetrics {

    private final MeterRegistry registry;

    public WardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the outcome of a start request.
     *
     * @param outcome "started", "unchanged", "failed", "rejected" or "cancelled"
     */
    public void recordStart(String outcome) {
        Counter.builder("warden.sidecar.starts")
                .description("Sidecar start requests by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStartupDuration(long ms) {
        Timer.builder("warden.sidecar.startup.duration")
                .description("Time from launch until the sidecar bound its port")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a restart of an already tracked sidecar.
     *
     * @param reason "config_changed", "address_changed" or "process_died"
     */
    public void recordRestart(String reason) {
        Counter.builder("warden.sidecar.restarts")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordStop() {
        Counter.builder("warden.sidecar.stops")
                .register(registry)
                .increment();
    }

    /**
     * Records a refused port.
     *
     * @param owner "tenant" when another live tenant holds it, "foreign" for unknown processes
     */
    public void recordPortConflict(String owner) {
        Counter.builder("warden.sidecar.port_conflicts")
                .description("Ports refused because they were held by someone else")
                .tag("owner", owner)
                .register(registry)
                .increment();
    }

    public void recordZombiesKilled() {
        Counter.builder("warden.sidecar.zombies_killed")
                .description("Zombie sweeps that terminated at least one orphaned sidecar")
                .register(registry)
                .increment();
    }
}

package com.flagship.roster_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for roster moves and waiver runs.
 *
 * <ul>
 *   <li>{@code roster.moves} by status and source</li>
 *   <li>{@code roster.moves.latency}</li>
 *   <li>{@code waiver.claims.processed} by outcome</li>
 *   <li>{@code waiver.runs} by result, {@code waiver.runs.duration}, {@code waiver.runs.skipped}</li>
 *   <li>{@code waiver.claims.submitted}, {@code idempotency.cache}</li>
 * </ul>
 */
@Component
public class RosterMetrics {

    private final MeterRegistry registry;
    private final Timer moveTimer;
    private final Timer runTimer;

    public RosterMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.moveTimer = Timer.builder("roster.moves.latency")
                .description("Time to execute a roster move, including rollback on rejection")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.runTimer = Timer.builder("waiver.runs.duration")
                .description("Time to resolve one league's batch of claims")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordMove(String status, String source, Duration duration) {
        registry.counter("roster.moves",
                "status", sanitizeTag(status),
                "source", sanitizeTag(source)
        ).increment();
        moveTimer.record(duration);
    }

    public void recordClaimProcessed(String outcome) {
        registry.counter("waiver.claims.processed", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRun(String result, Duration duration) {
        registry.counter("waiver.runs", "result", sanitizeTag(result)).increment();
        runTimer.record(duration);
    }

    public void recordRunSkipped(String reason) {
        registry.counter("waiver.runs.skipped", "reason", sanitizeTag(reason)).increment();
    }

    public void recordClaimSubmitted(String result) {
        registry.counter("waiver.claims.submitted", "result", sanitizeTag(result)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

package com.phillippitts.speakermatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for speaker scoring.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Per-item scoring latency per provider</li>
 *   <li>Success/failure counts per provider, failures tagged by reason</li>
 *   <li>Whole-batch latency</li>
 * </ul>
 *
 * <p>Exposed via Micrometer at /actuator/metrics.
 */
@Component
public class ScoringMetrics {

    private static final String SCORING_PREFIX = "speakermatch.scoring";
    private static final String MATCHING_PREFIX = "speakermatch.matching";

    private final MeterRegistry registry;

    public ScoringMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one speaker took to score.
     *
     * @param provider      provider name (openai, anthropic)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String provider, long durationNanos) {
        Timer.builder(SCORING_PREFIX + ".latency")
                .description("Time taken to score one speaker")
                .tag("provider", provider)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String provider) {
        Counter.builder(SCORING_PREFIX + ".success")
                .description("Number of speakers scored successfully")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * @param provider provider name
     * @param reason   failure category (provider, parse, unexpected)
     */
    public void incrementFailure(String provider, String reason) {
        Counter.builder(SCORING_PREFIX + ".failure")
                .description("Number of speakers degraded to a zero score")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records a completed fan-out batch.
     *
     * @param durationNanos time from submission to the last result
     */
    public void recordBatch(long durationNanos) {
        Timer.builder(MATCHING_PREFIX + ".batch")
                .description("Time taken to score a full catalog")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}

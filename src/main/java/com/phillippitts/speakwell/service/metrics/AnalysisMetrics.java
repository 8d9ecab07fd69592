package com.phillippitts.speakwell.service.metrics;

import com.phillippitts.speakwell.domain.AnalysisResult;
import com.phillippitts.speakwell.domain.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for pronunciation analyses.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Analysis latency</li>
 *   <li>Distribution of overall scores</li>
 *   <li>Word classifications by error type</li>
 *   <li>Failures by reason</li>
 *   <li>Rubric resolution by source (patient, doctor, default, fallback)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
public class AnalysisMetrics {

    static final String METRIC_PREFIX = "speakwell.analysis";
    static final String RUBRIC_METRIC = "speakwell.rubric.resolution";

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Records one completed analysis: latency, score and per-type word counts.
     *
     * @param result        analysis outcome
     * @param durationNanos time spent analyzing, in nanoseconds
     */
    public void recordAnalysis(AnalysisResult result, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to align and score a transcript")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);

        DistributionSummary.builder(METRIC_PREFIX + ".score")
                .description("Overall pronunciation scores")
                .baseUnit("points")
                .register(registry)
                .record(result.overallScore());

        for (ErrorType type : ErrorType.values()) {
            long n = result.count(type);
            if (n > 0) {
                Counter.builder(METRIC_PREFIX + ".words")
                        .description("Classified words by error type")
                        .tag("error", type.wireName())
                        .register(registry)
                        .increment(n);
            }
        }
    }

    /**
     * Increments the failure counter.
     *
     * @param reason failure reason (invalid_rubric, transcription_error)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed analyses")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records which level a rubric was resolved from.
     *
     * @param source patient, doctor, default or fallback
     */
    public void recordRubricResolution(String source) {
        Counter.builder(RUBRIC_METRIC)
                .description("Rubric resolutions by source")
                .tag("source", source)
                .register(registry)
                .increment();
    }
}

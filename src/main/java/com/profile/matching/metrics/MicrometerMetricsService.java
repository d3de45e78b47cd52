package com.profile.matching.metrics;

import com.profile.matching.llm.ReasonSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code match.duration}: Timer</li>
 *   <li>{@code match.candidates}: DistributionSummary</li>
 *   <li>{@code match.structural.score}: DistributionSummary</li>
 *   <li>{@code match.final.score}: DistributionSummary</li>
 *   <li>{@code match.reason.source}: Counter (tag: source)</li>
 *   <li>{@code match.results.filtered}: Counter</li>
 *   <li>{@code match.retrieval.failure}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer matchTimer;
    private final DistributionSummary candidateCountSummary;
    private final DistributionSummary structuralScoreSummary;
    private final DistributionSummary finalScoreSummary;
    private final Map<ReasonSource, Counter> reasonSourceCounters = new EnumMap<>(ReasonSource.class);
    private final Counter filteredCounter;
    private final Counter retrievalFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.matchTimer = Timer.builder("match.duration")
                .description("Duration of matching requests")
                .register(registry);
        this.candidateCountSummary = DistributionSummary.builder("match.candidates")
                .description("Number of candidates per matching request")
                .register(registry);
        this.structuralScoreSummary = DistributionSummary.builder("match.structural.score")
                .description("Distribution of knowledge-graph structural scores")
                .register(registry);
        this.finalScoreSummary = DistributionSummary.builder("match.final.score")
                .description("Distribution of blended final scores")
                .register(registry);
        for (ReasonSource source : ReasonSource.values()) {
            reasonSourceCounters.put(source, Counter.builder("match.reason.source")
                    .description("Number of reasons produced, by chain stage")
                    .tag("source", source.name())
                    .register(registry));
        }
        this.filteredCounter = Counter.builder("match.results.filtered")
                .description("Number of results dropped by the minimum score threshold")
                .register(registry);
        this.retrievalFailureCounter = Counter.builder("match.retrieval.failure")
                .description("Number of similarity retrieval failures")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(Duration duration) {
        matchTimer.record(duration);
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateCountSummary.record(count);
    }

    @Override
    public void recordStructuralScore(double score) {
        structuralScoreSummary.record(score);
    }

    @Override
    public void recordFinalScore(double score) {
        finalScoreSummary.record(score);
    }

    @Override
    public void incrementReasonSource(ReasonSource source) {
        reasonSourceCounters.get(source).increment();
    }

    @Override
    public void incrementFilteredResults(int count) {
        filteredCounter.increment(count);
    }

    @Override
    public void incrementRetrievalFailure() {
        retrievalFailureCounter.increment();
    }
}

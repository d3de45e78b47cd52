package com.profile.matching.metrics;

import com.profile.matching.llm.ReasonSource;

import java.time.Duration;

/**
 * Sink for matching metrics. {@link NoOpMetricsService} is the default so the library
 * runs without Micrometer on the classpath; {@link MicrometerMetricsService} records them.
 */
public interface MetricsService {

    /** Wall-clock time of one ranking request. */
    void recordMatchDuration(Duration duration);

    void recordCandidateCount(int count);

    void recordStructuralScore(double score);

    /** Blended score, recorded before threshold filtering. */
    void recordFinalScore(double score);

    /** One reason produced by the given stage of the reason chain. */
    void incrementReasonSource(ReasonSource source);

    void incrementFilteredResults(int count);

    void incrementRetrievalFailure();
}

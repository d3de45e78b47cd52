package com.profile.matching.metrics;

import com.profile.matching.llm.ReasonSource;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(Duration duration) {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void recordStructuralScore(double score) {
    }

    @Override
    public void recordFinalScore(double score) {
    }

    @Override
    public void incrementReasonSource(ReasonSource source) {
    }

    @Override
    public void incrementFilteredResults(int count) {
    }

    @Override
    public void incrementRetrievalFailure() {
    }
}

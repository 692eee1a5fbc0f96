package com.facility.resolution.metrics;

import com.facility.resolution.core.model.MatchStrategyType;

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
    public void incrementStrategyFailure(MatchStrategyType strategy) {
    }

    @Override
    public void recordDuplicateGroups(int groups) {
    }

    @Override
    public void incrementRecordsMerged(int absorbed) {
    }

    @Override
    public void incrementRecordsSkipped() {
    }

    @Override
    public void incrementSlugCollision() {
    }
}

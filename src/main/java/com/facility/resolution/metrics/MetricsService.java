package com.facility.resolution.metrics;

import com.facility.resolution.core.model.MatchStrategyType;

import java.time.Duration;

/**
 * Records facility resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the core runs without a metrics backend.
 */
public interface MetricsService {

    void recordMatchDuration(Duration duration);

    void recordCandidateCount(int count);

    void incrementStrategyFailure(MatchStrategyType strategy);

    void recordDuplicateGroups(int groups);

    void incrementRecordsMerged(int absorbed);

    void incrementRecordsSkipped();

    void incrementSlugCollision();
}

package com.facility.resolution.metrics;

import com.facility.resolution.core.model.MatchStrategyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code facility.match.duration}: Timer</li>
 *   <li>{@code facility.match.candidates}: DistributionSummary</li>
 *   <li>{@code facility.match.strategy.failure}: Counter (tag: strategy)</li>
 *   <li>{@code facility.groups.found}: DistributionSummary</li>
 *   <li>{@code facility.merged}: Counter</li>
 *   <li>{@code facility.records.skipped}: Counter</li>
 *   <li>{@code facility.slug.collision}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer matchTimer;
    private final DistributionSummary candidateSummary;
    private final DistributionSummary groupSummary;
    private final Counter mergedCounter;
    private final Counter skippedCounter;
    private final Counter slugCollisionCounter;
    private final Map<MatchStrategyType, Counter> strategyFailureCounters = new EnumMap<>(MatchStrategyType.class);

    public MicrometerMetricsService(MeterRegistry registry) {
        this.matchTimer = Timer.builder("facility.match.duration")
                .description("Duration of duplicate detection for one record")
                .register(registry);
        this.candidateSummary = DistributionSummary.builder("facility.match.candidates")
                .description("Ranked candidates returned per query record")
                .register(registry);
        this.groupSummary = DistributionSummary.builder("facility.groups.found")
                .description("Duplicate groups found per grouping pass")
                .register(registry);
        this.mergedCounter = Counter.builder("facility.merged")
                .description("Records absorbed into a surviving record")
                .register(registry);
        this.skippedCounter = Counter.builder("facility.records.skipped")
                .description("Malformed records skipped at the boundary")
                .register(registry);
        this.slugCollisionCounter = Counter.builder("facility.slug.collision")
                .description("Slug requests that needed disambiguation")
                .register(registry);
        for (MatchStrategyType strategy : MatchStrategyType.values()) {
            strategyFailureCounters.put(strategy, Counter.builder("facility.match.strategy.failure")
                    .description("Matching strategies that failed and were skipped")
                    .tag("strategy", strategy.id())
                    .register(registry));
        }
    }

    @Override
    public void recordMatchDuration(Duration duration) {
        matchTimer.record(duration);
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateSummary.record(count);
    }

    @Override
    public void incrementStrategyFailure(MatchStrategyType strategy) {
        strategyFailureCounters.get(strategy).increment();
    }

    @Override
    public void recordDuplicateGroups(int groups) {
        groupSummary.record(groups);
    }

    @Override
    public void incrementRecordsMerged(int absorbed) {
        mergedCounter.increment(absorbed);
    }

    @Override
    public void incrementRecordsSkipped() {
        skippedCounter.increment();
    }

    @Override
    public void incrementSlugCollision() {
        slugCollisionCounter.increment();
    }
}

package com.facility.resolution.match;

import com.facility.resolution.api.DeduplicationOptions;
import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.MatchStrategyType;
import com.facility.resolution.core.validation.RecordValidator;
import com.facility.resolution.core.validation.ValidationException;
import com.facility.resolution.logging.LogContext;
import com.facility.resolution.metrics.MetricsService;
import com.facility.resolution.metrics.NoOpMetricsService;
import com.facility.resolution.similarity.StringSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the match strategies for one query record and returns ranked candidates.
 *
 * <p>Strategies run in fixed priority order. A strategy that throws is logged and skipped;
 * the others still contribute. A malformed query yields no candidates.</p>
 */
public class CandidateMatcher {
    private static final Logger log = LoggerFactory.getLogger(CandidateMatcher.class);

    private final List<MatchStrategy> strategies;
    private final MetricsService metricsService;

    public CandidateMatcher(List<MatchStrategy> strategies, MetricsService metricsService) {
        List<MatchStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparingInt(s -> s.type().priority()));
        this.strategies = List.copyOf(ordered);
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Creates a matcher with the five standard strategies configured from {@code options}.
     */
    public static CandidateMatcher create(DeduplicationOptions options, ExternalFacilityDataset dataset,
                                          StringSimilarity similarity, MetricsService metricsService) {
        CrossReferenceStrategy crossReference =
                new CrossReferenceStrategy(dataset, similarity, options.getCrossReferenceThreshold());
        if (!crossReference.isEnabled()) {
            log.info("No external facility dataset configured, cross-reference matching disabled");
        }
        List<MatchStrategy> strategies = List.of(
                new ExactNameStrategy(options.getExactNameConfidence()),
                new AliasMatchStrategy(options.getAliasConfidence()),
                new LocationProximityStrategy(options.getProximityRadiusKm(),
                        options.getProximityMaxConfidence(), options.getProximityMinConfidence()),
                new CompanyCommodityStrategy(options.getCompanyRadiusKm(),
                        options.getCompanyMaxConfidence(), options.getCompanyMinConfidence(),
                        options.getCompanyNoCoordinatesConfidence()),
                crossReference);
        return new CandidateMatcher(strategies, metricsService);
    }

    public List<Candidate> findDuplicates(FacilityRecord record, FacilityCorpus corpus) {
        return findDuplicates(record, corpus, EnumSet.allOf(MatchStrategyType.class));
    }

    /**
     * Finds candidates for {@code record} using only the enabled strategies.
     */
    public List<Candidate> findDuplicates(FacilityRecord record, FacilityCorpus corpus,
                                          Set<MatchStrategyType> enabled) {
        try {
            RecordValidator.validate(record);
        } catch (ValidationException e) {
            log.warn("Skipping malformed query record: {}", e.getMessage());
            metricsService.incrementRecordsSkipped();
            return List.of();
        }

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forMatch(LogContext.generateCorrelationId(), record.getFacilityId())) {
            List<Candidate> raw = new ArrayList<>();
            for (MatchStrategy strategy : strategies) {
                if (!enabled.contains(strategy.type())) {
                    continue;
                }
                try {
                    List<Candidate> found = strategy.evaluate(record, corpus);
                    log.debug("Strategy {} produced {} candidates", strategy.type().id(), found.size());
                    raw.addAll(found);
                } catch (RuntimeException e) {
                    log.warn("Strategy {} failed for facility {}", strategy.type().id(), record.getFacilityId(), e);
                    metricsService.incrementStrategyFailure(strategy.type());
                }
            }

            List<Candidate> ranked = CandidateRanker.rank(raw);
            metricsService.recordMatchDuration(Duration.ofNanos(System.nanoTime() - start));
            metricsService.recordCandidateCount(ranked.size());
            log.debug("Found {} candidates for '{}'", ranked.size(), record.getName());
            return ranked;
        }
    }

    public List<MatchStrategy> getStrategies() {
        return strategies;
    }
}

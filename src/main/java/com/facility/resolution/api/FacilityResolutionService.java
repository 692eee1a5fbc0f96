package com.facility.resolution.api;

import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.Location;
import com.facility.resolution.core.model.MatchStrategyType;
import com.facility.resolution.core.validation.RecordValidator;
import com.facility.resolution.geo.Geohash;
import com.facility.resolution.logging.LogContext;
import com.facility.resolution.match.CandidateMatcher;
import com.facility.resolution.match.ExternalFacilityDataset;
import com.facility.resolution.match.FacilityCorpus;
import com.facility.resolution.merge.CompletenessScorer;
import com.facility.resolution.merge.DuplicateGrouper;
import com.facility.resolution.merge.MergeEngine;
import com.facility.resolution.merge.MergeResult;
import com.facility.resolution.metrics.MetricsService;
import com.facility.resolution.metrics.NoOpMetricsService;
import com.facility.resolution.similarity.CachingStringSimilarity;
import com.facility.resolution.similarity.IndelSimilarity;
import com.facility.resolution.similarity.StringSimilarity;
import com.facility.resolution.slug.CanonicalName;
import com.facility.resolution.slug.FacilityNameCanonicalizer;
import com.facility.resolution.slug.SlugRegistry;
import com.facility.resolution.tracing.NoOpTracingService;
import com.facility.resolution.tracing.Span;
import com.facility.resolution.tracing.SpanAttribute;
import com.facility.resolution.tracing.SpanOperation;
import com.facility.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Main entry point for facility identity resolution.
 *
 * <p>All operations are pure with respect to their inputs: records are never modified and
 * nothing is persisted, so every call doubles as a dry run.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * FacilityResolutionService service = FacilityResolutionService.builder()
 *     .options(DeduplicationOptions.defaults())
 *     .externalDataset(dataset)
 *     .build();
 *
 * // Candidates for one incoming record
 * List&lt;Candidate&gt; candidates = service.findDuplicates(incoming, service.corpus(existing));
 *
 * // Batch cleanup
 * DeduplicationReport report = service.deduplicate(existing);
 * report.survivors().forEach(repository::save);
 * report.absorbedIds().forEach(repository::delete);
 * </pre>
 */
public class FacilityResolutionService {
    private static final Logger log = LoggerFactory.getLogger(FacilityResolutionService.class);

    static final int SLUG_GEOHASH_PRECISION = 6;

    private final DeduplicationOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final CandidateMatcher matcher;
    private final DuplicateGrouper grouper;
    private final CompletenessScorer scorer;
    private final MergeEngine mergeEngine;
    private final FacilityNameCanonicalizer canonicalizer;

    private FacilityResolutionService(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;

        StringSimilarity similarity = CachingStringSimilarity.wrap(
                builder.stringSimilarity != null ? builder.stringSimilarity : new IndelSimilarity(),
                options.getSimilarityCache());

        this.matcher = CandidateMatcher.create(options, builder.externalDataset, similarity, metricsService);
        this.grouper = new DuplicateGrouper(options, similarity, metricsService);
        this.scorer = new CompletenessScorer();
        this.mergeEngine = new MergeEngine(scorer, metricsService);
        this.canonicalizer = new FacilityNameCanonicalizer(builder.companyNameLookup);

        log.info("FacilityResolutionService initialized with similarity backend {} and options {}",
                similarity.getName(), options);
    }

    /**
     * Builds a validated snapshot of {@code records} to match against.
     */
    public FacilityCorpus corpus(Collection<FacilityRecord> records) {
        return FacilityCorpus.of(records);
    }

    public List<Candidate> findDuplicates(FacilityRecord record, FacilityCorpus corpus) {
        return findDuplicates(record, corpus, Set.of(MatchStrategyType.values()));
    }

    /**
     * Ranked candidates for {@code record}, using only the given strategies.
     */
    public List<Candidate> findDuplicates(FacilityRecord record, FacilityCorpus corpus,
                                          Set<MatchStrategyType> strategies) {
        String facilityId = record != null ? record.getFacilityId() : null;
        try (Span span = tracingService.startSpan(SpanOperation.FIND_DUPLICATES, facilityId)) {
            List<Candidate> candidates = matcher.findDuplicates(record, corpus, strategies);
            span.setAttribute(SpanAttribute.CORPUS_SIZE, corpus.size());
            span.setAttribute(SpanAttribute.CANDIDATES, candidates.size());
            span.succeed();
            return candidates;
        }
    }

    public List<List<FacilityRecord>> findDuplicateGroups(Collection<FacilityRecord> records) {
        try (Span span = tracingService.startSpan(SpanOperation.FIND_DUPLICATE_GROUPS);
             LogContext ctx = LogContext.forBatch(LogContext.generateCorrelationId(), "group")) {
            List<List<FacilityRecord>> groups = grouper.findDuplicateGroups(records);
            span.setAttribute(SpanAttribute.RECORDS, records.size());
            span.setAttribute(SpanAttribute.GROUPS, groups.size());
            span.succeed();
            return groups;
        }
    }

    public MergeResult mergeGroup(List<FacilityRecord> group) {
        try (Span span = tracingService.startSpan(SpanOperation.MERGE_GROUP)) {
            try {
                span.setAttribute(SpanAttribute.GROUP_SIZE, group != null ? group.size() : 0);
                MergeResult result = mergeEngine.mergeGroup(group);
                span.setAttribute(SpanAttribute.FACILITY_ID, result.canonical().getFacilityId());
                span.setAttribute(SpanAttribute.ABSORBED, result.absorbedIds().size());
                span.succeed();
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    /**
     * Completeness score used to pick merge survivors.
     */
    public double score(FacilityRecord record) {
        return scorer.score(record);
    }

    /**
     * Creates a slug registry for one batch, seeded with the slugs already assigned in the corpus.
     */
    public SlugRegistry newSlugRegistry(Collection<String> existingSlugs) {
        SlugRegistry registry = new SlugRegistry(metricsService);
        registry.loadExisting(existingSlugs);
        return registry;
    }

    /**
     * Computes canonical names and unique slugs for records that have no slug yet, in input order.
     * Malformed records are skipped. Slugs are reserved in {@code registry}; records are not modified.
     */
    public List<SlugAssignment> assignCanonicalNames(Collection<FacilityRecord> records, SlugRegistry registry) {
        try (Span span = tracingService.startSpan(SpanOperation.ASSIGN_CANONICAL_NAMES);
             LogContext ctx = LogContext.forBatch(LogContext.generateCorrelationId(), "slug")) {
            List<SlugAssignment> assignments = new ArrayList<>();
            for (FacilityRecord record : RecordValidator.filterValid(records, e -> metricsService.incrementRecordsSkipped())) {
                if (record.getCanonicalSlug() != null && !record.getCanonicalSlug().isBlank()) {
                    continue;
                }
                CanonicalName name = canonicalizer.canonicalize(record);
                Location location = record.getLocation();
                String region = location != null ? location.region() : null;
                String town = location != null ? location.town() : null;
                String geohash = record.hasCoordinates()
                        ? Geohash.encode(record.getLat(), record.getLon(), SLUG_GEOHASH_PRECISION)
                        : null;
                String slug = registry.unique(name.slugBase(), region, town, geohash);
                assignments.add(new SlugAssignment(record.getFacilityId(), name, slug));
            }
            log.info("Assigned {} canonical slugs", assignments.size());
            span.setAttribute(SpanAttribute.ASSIGNED, assignments.size());
            span.succeed();
            return assignments;
        }
    }

    /**
     * Groups duplicates and merges every group. Returns what should change without changing anything.
     */
    public DeduplicationReport deduplicate(Collection<FacilityRecord> records) {
        try (Span span = tracingService.startSpan(SpanOperation.DEDUPLICATE);
             LogContext ctx = LogContext.forBatch(LogContext.generateCorrelationId(), "deduplicate")) {
            List<String> skipped = new ArrayList<>();
            for (FacilityRecord record : records) {
                if (!RecordValidator.isValid(record)) {
                    skipped.add(record != null ? String.valueOf(record.getFacilityId()) : "null");
                }
            }

            List<MergeResult> merges = new ArrayList<>();
            for (List<FacilityRecord> group : grouper.findDuplicateGroups(records)) {
                MergeResult result = mergeEngine.mergeGroup(group);
                if (!result.isNoOp()) {
                    merges.add(result);
                }
            }

            DeduplicationReport report = new DeduplicationReport(merges, skipped, records.size());
            log.info("Deduplication finished: {}", report);
            span.setAttribute(SpanAttribute.RECORDS, records.size());
            span.setAttribute(SpanAttribute.GROUPS, merges.size());
            span.succeed();
            return report;
        }
    }

    public DeduplicationOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FacilityResolutionService.
     */
    public static class Builder {
        private DeduplicationOptions options = DeduplicationOptions.defaults();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private ExternalFacilityDataset externalDataset;
        private StringSimilarity stringSimilarity;
        private Function<String, String> companyNameLookup;

        /**
         * Sets deduplication options.
         */
        public Builder options(DeduplicationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom tracing service.
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Sets the external canonical dataset. Without one, cross-reference matching is disabled.
         */
        public Builder externalDataset(ExternalFacilityDataset externalDataset) {
            this.externalDataset = externalDataset;
            return this;
        }

        /**
         * Sets the name similarity backend. Defaults to {@link IndelSimilarity}.
         */
        public Builder stringSimilarity(StringSimilarity stringSimilarity) {
            this.stringSimilarity = stringSimilarity;
            return this;
        }

        /**
         * Sets the operator name lookup used for canonical names.
         */
        public Builder companyNameLookup(Function<String, String> companyNameLookup) {
            this.companyNameLookup = companyNameLookup;
            return this;
        }

        public FacilityResolutionService build() {
            if (options == null) {
                throw new IllegalStateException("DeduplicationOptions are required");
            }
            if (metricsService == null) {
                metricsService = new NoOpMetricsService();
            }
            if (tracingService == null) {
                tracingService = new NoOpTracingService();
            }
            return new FacilityResolutionService(this);
        }
    }
}

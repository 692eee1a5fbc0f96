package com.facility.resolution.api;

import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.Commodity;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.Location;
import com.facility.resolution.core.model.MatchStrategyType;
import com.facility.resolution.merge.MergeResult;
import com.facility.resolution.metrics.MicrometerMetricsService;
import com.facility.resolution.slug.SlugRegistry;
import com.facility.resolution.tracing.Span;
import com.facility.resolution.tracing.SpanAttribute;
import com.facility.resolution.tracing.SpanOperation;
import com.facility.resolution.tracing.TracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("FacilityResolutionService Tests")
@ExtendWith(MockitoExtension.class)
class FacilityResolutionServiceTest {

    private FacilityResolutionService service;

    @BeforeEach
    void setUp() {
        service = FacilityResolutionService.builder().build();
    }

    private static FacilityRecord.Builder facility(String id, String name) {
        return FacilityRecord.builder().facilityId(id).name(name);
    }

    @Test
    @DisplayName("Builder rejects missing options")
    void builderRequiresOptions() {
        assertThrows(IllegalStateException.class,
                () -> FacilityResolutionService.builder().options(null).build());
    }

    @Nested
    @DisplayName("Batch deduplication")
    class DeduplicateTests {

        @Test
        @DisplayName("Groups, merges and reports skipped records")
        void deduplicate() {
            List<FacilityRecord> records = List.of(
                    facility("s1", "Stillwater Mine").coordinates(45.50, -109.80)
                            .commodity(Commodity.of("platinum")).status("operating").build(),
                    facility("s2", "Stillwater Mine").coordinates(45.501, -109.801).build(),
                    facility("p1", "Prominent Hill").coordinates(-29.18, 135.52).build(),
                    facility("x", "Lonely Mill").coordinates(10.0, 10.0).build(),
                    facility("bad", " ").build());

            DeduplicationReport report = service.deduplicate(records);

            assertEquals(5, report.inputCount());
            assertEquals(List.of("bad"), report.skippedIds());
            assertTrue(report.hasDuplicates());
            assertEquals(1, report.merges().size());
            assertEquals("s1", report.survivors().get(0).getFacilityId());
            assertEquals(List.of("s2"), report.absorbedIds());
            assertEquals("Merged from: s2", report.survivors().get(0).getVerification().notes());
        }

        @Test
        @DisplayName("Clean corpus yields an empty report")
        void noDuplicates() {
            DeduplicationReport report = service.deduplicate(List.of(
                    facility("a", "Cadia").coordinates(-33.45, 148.99).build(),
                    facility("b", "Kambalda").coordinates(-31.2, 121.6).build()));

            assertFalse(report.hasDuplicates());
            assertTrue(report.absorbedIds().isEmpty());
            assertEquals("DeduplicationReport{input=2, groups=0, absorbed=0, skipped=0}", report.toString());
        }

        @Test
        @DisplayName("Input records are left untouched")
        void dryRun() {
            FacilityRecord s1 = facility("s1", "Stillwater Mine").coordinates(45.50, -109.80).build();
            FacilityRecord s2 = facility("s2", "Stillwater Mine West").coordinates(45.501, -109.801).build();

            service.deduplicate(List.of(s1, s2));

            assertTrue(s1.getAliases().isEmpty());
            assertNull(s1.getVerification().notes());
        }
    }

    @Nested
    @DisplayName("Candidate matching")
    class MatchTests {

        @Test
        @DisplayName("Finds ranked candidates in a corpus")
        void findDuplicates() {
            List<FacilityRecord> existing = List.of(
                    facility("s1", "Stillwater Mine").coordinates(45.50, -109.80).build(),
                    facility("p1", "Prominent Hill").coordinates(-29.18, 135.52).build());

            List<Candidate> candidates = service.findDuplicates(
                    facility("q", "stillwater mine").build(), service.corpus(existing));

            assertEquals(1, candidates.size());
            assertEquals("s1", candidates.get(0).targetId());
            assertEquals(MatchStrategyType.EXACT_NAME, candidates.get(0).strategy());
            assertEquals(1, candidates.get(0).rank());
        }

        @Test
        @DisplayName("Score delegates to the completeness scorer")
        void score() {
            assertEquals(10.0, service.score(facility("a", "Cadia").coordinates(-33.45, 148.99).build()));
        }
    }

    @Nested
    @DisplayName("Canonical names and slugs")
    class SlugTests {

        @Test
        @DisplayName("Assigns unique slugs to records without one")
        void assignCanonicalNames() {
            SlugRegistry registry = service.newSlugRegistry(List.of("olympic-dam-mine"));
            FacilityRecord located = facility("a", "Olympic Dam")
                    .type("mine")
                    .location(Location.of(-30.44, 136.88).withPlace(null, "South Australia"))
                    .build();
            FacilityRecord slugged = facility("b", "Olympic Dam").canonicalSlug("olympic-dam").build();
            FacilityRecord unlocated = facility("c", "Olympic Dam Mine").type("mine").build();

            List<SlugAssignment> assignments = service.assignCanonicalNames(
                    List.of(located, slugged, unlocated), registry);

            assertEquals(2, assignments.size());
            assertEquals("a", assignments.get(0).facilityId());
            assertEquals("olympic-dam-mine-south-australia", assignments.get(0).slug());
            assertEquals("Olympic Dam Mine", assignments.get(0).canonicalName().canonicalName());
            assertEquals("c", assignments.get(1).facilityId());
            assertEquals("olympic-dam-mine-2", assignments.get(1).slug());
            assertTrue(registry.contains("olympic-dam-mine-2"));
        }

        @Test
        @DisplayName("Geohash prefix disambiguates when no place is known")
        void geohashDisambiguation() {
            SlugRegistry registry = service.newSlugRegistry(List.of("kambalda-mine"));
            FacilityRecord record = facility("k", "Kambalda").type("mine").coordinates(-31.2, 121.6).build();

            String slug = service.assignCanonicalNames(List.of(record), registry).get(0).slug();

            assertTrue(slug.startsWith("kambalda-mine-"));
            assertEquals("kambalda-mine-".length() + FacilityResolutionService.SLUG_GEOHASH_PRECISION, slug.length());
        }

        @Test
        @DisplayName("Applying an assignment returns an updated copy")
        void applyTo() {
            FacilityRecord record = facility("a", "Olympic Dam").type("mine").build();
            SlugAssignment assignment = service.assignCanonicalNames(
                    List.of(record), service.newSlugRegistry(List.of())).get(0);

            FacilityRecord updated = assignment.applyTo(record);

            assertEquals("olympic-dam-mine", updated.getCanonicalSlug());
            assertEquals("Olympic Dam Mine", updated.getCanonicalName());
            assertNull(record.getCanonicalSlug());
            assertThrows(IllegalArgumentException.class,
                    () -> assignment.applyTo(facility("other", "Olympic Dam").build()));
        }

        @Test
        @DisplayName("Slug collisions are reported to the metrics service")
        void collisionMetric() {
            SimpleMeterRegistry meters = new SimpleMeterRegistry();
            FacilityResolutionService metered = FacilityResolutionService.builder()
                    .metricsService(new MicrometerMetricsService(meters))
                    .build();

            metered.assignCanonicalNames(List.of(
                    facility("a", "Cadia").type("mine").build(),
                    facility("b", "Cadia Mine").type("mine").build()), metered.newSlugRegistry(List.of()));

            assertEquals(1.0, meters.get("facility.slug.collision").counter().count());
        }
    }

    @Nested
    @DisplayName("Tracing")
    class TracingTests {

        @Mock
        private TracingService tracing;

        @Mock
        private Span span;

        private FacilityResolutionService traced;

        @BeforeEach
        void setUp() {
            lenient().when(tracing.startSpan(any(SpanOperation.class))).thenReturn(span);
            lenient().when(tracing.startSpan(any(SpanOperation.class), any())).thenReturn(span);
            traced = FacilityResolutionService.builder().tracingService(tracing).build();
        }

        @Test
        @DisplayName("Candidate search runs in a span tagged with the query id")
        void findDuplicatesSpan() {
            traced.findDuplicates(facility("q", "Cadia").build(), traced.corpus(List.of()));

            verify(tracing).startSpan(SpanOperation.FIND_DUPLICATES, "q");
            verify(span).setAttribute(SpanAttribute.CANDIDATES, 0L);
            verify(span).succeed();
            verify(span).close();
        }

        @Test
        @DisplayName("Failed merge records the exception and marks the span as failed")
        void mergeFailureSpan() {
            assertThrows(IllegalArgumentException.class, () -> traced.mergeGroup(List.of()));

            verify(tracing).startSpan(SpanOperation.MERGE_GROUP);
            verify(span).fail(any(IllegalArgumentException.class));
            verify(span, never()).succeed();
            verify(span).close();
        }

        @Test
        @DisplayName("Successful merge tags survivor and absorbed count")
        void mergeSpan() {
            MergeResult result = traced.mergeGroup(List.of(
                    facility("a", "Cadia").coordinates(-33.45, 148.99).build(),
                    facility("b", "Cadia Valley").build()));

            assertEquals("a", result.canonical().getFacilityId());
            verify(span).setAttribute(SpanAttribute.GROUP_SIZE, 2L);
            verify(span).setAttribute(SpanAttribute.FACILITY_ID, "a");
            verify(span).setAttribute(SpanAttribute.ABSORBED, 1L);
            verify(span).succeed();
        }

        @Test
        @DisplayName("Batch grouping span carries record and group counts")
        void groupsSpan() {
            traced.findDuplicateGroups(List.of(
                    facility("a", "Cadia").coordinates(-33.45, 148.99).build(),
                    facility("b", "Cadia").coordinates(-33.45, 148.99).build(),
                    facility("c", "Olympic Dam").coordinates(-30.44, 136.88).build()));

            verify(tracing).startSpan(SpanOperation.FIND_DUPLICATE_GROUPS);
            verify(span).setAttribute(SpanAttribute.RECORDS, 3L);
            verify(span).setAttribute(SpanAttribute.GROUPS, 1L);
            verify(span).succeed();
        }
    }
}

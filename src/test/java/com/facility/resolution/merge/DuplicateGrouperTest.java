package com.facility.resolution.merge;

import com.facility.resolution.api.DeduplicationOptions;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.metrics.MicrometerMetricsService;
import com.facility.resolution.similarity.IndelSimilarity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DuplicateGrouper Tests")
class DuplicateGrouperTest {

    private final DuplicateGrouper grouper = new DuplicateGrouper(DeduplicationOptions.defaults(), new IndelSimilarity());

    private static FacilityRecord located(String id, String name, double lat, double lon) {
        return FacilityRecord.builder().facilityId(id).name(name).coordinates(lat, lon).build();
    }

    private static FacilityRecord unlocated(String id, String name, String... aliases) {
        return FacilityRecord.builder().facilityId(id).name(name).aliases(List.of(aliases)).build();
    }

    private static List<List<String>> ids(List<List<FacilityRecord>> groups) {
        return groups.stream()
                .map(group -> group.stream().map(FacilityRecord::getFacilityId).toList())
                .toList();
    }

    @Nested
    @DisplayName("Pair test")
    class PairTests {

        @Test
        @DisplayName("Tier 1: very close coordinates and moderately similar names")
        void tier1() {
            assertTrue(grouper.isDuplicate(
                    located("a", "Stillwater Mine", 45.50, -109.80),
                    located("b", "Stillwater East Mine", 45.505, -109.805)));
        }

        @Test
        @DisplayName("Tier 2: close coordinates need highly similar names")
        void tier2() {
            assertTrue(grouper.isDuplicate(
                    located("a", "Stillwater Mine", 45.50, -109.80),
                    located("b", "Stillwater Mines", 45.55, -109.80)));
            assertFalse(grouper.isDuplicate(
                    located("a", "Stillwater Mine", 45.50, -109.80),
                    located("b", "Stillwater West Pit", 45.55, -109.80)));
        }

        @Test
        @DisplayName("Substring containment counts as a name match")
        void containment() {
            assertTrue(grouper.isDuplicate(
                    located("a", "Olympic Dam", -30.44, 136.88),
                    located("b", "Olympic Dam Copper Uranium Gold Operations", -30.48, 136.88)));
        }

        @Test
        @DisplayName("Far apart sites are not duplicates even with equal names")
        void farApart() {
            assertFalse(grouper.isDuplicate(
                    located("a", "Central Mine", 45.50, -109.80),
                    located("b", "Central Mine", 45.70, -109.80)));
        }

        @Test
        @DisplayName("Pair test is symmetric")
        void symmetric() {
            List<FacilityRecord> records = List.of(
                    located("a", "Stillwater Mine", 45.50, -109.80),
                    located("b", "Stillwater East Mine", 45.505, -109.805),
                    located("c", "Mine", 45.55, -109.80),
                    located("d", "East Boulder", 45.501, -109.80),
                    unlocated("e", "Stillwater Mine"),
                    unlocated("f", "Nye", "East Boulder"));

            for (FacilityRecord x : records) {
                for (FacilityRecord y : records) {
                    assertEquals(grouper.isDuplicate(x, y), grouper.isDuplicate(y, x),
                            x.getFacilityId() + " vs " + y.getFacilityId());
                }
            }
        }
    }

    @Nested
    @DisplayName("Grouping")
    class GroupingTests {

        @Test
        @DisplayName("Tier-1 scenario pair forms a group")
        void stillwaterPair() {
            List<List<FacilityRecord>> groups = grouper.findDuplicateGroups(List.of(
                    located("a", "Stillwater Mine", 45.50, -109.80),
                    located("b", "Stillwater Mine", 45.501, -109.801)));

            assertEquals(List.of(List.of("a", "b")), ids(groups));
        }

        @Test
        @DisplayName("Pair straddling a bucket boundary is still grouped")
        void straddlesBoundary() {
            FacilityRecord south = located("a", "Stillwater Mine", 45.049, -109.80);
            FacilityRecord north = located("b", "Stillwater Mine", 45.051, -109.80);
            assertTrue(grouper.isDuplicate(south, north));

            assertEquals(List.of(List.of("a", "b")), ids(grouper.findDuplicateGroups(List.of(south, north))));
        }

        @Test
        @DisplayName("Diagonal neighbours and tier-2 pairs across buckets are grouped")
        void neighbouringBuckets() {
            List<List<FacilityRecord>> groups = grouper.findDuplicateGroups(List.of(
                    located("d1", "Cadia", -33.449, 148.949),
                    located("d2", "Cadia", -33.451, 148.951),
                    located("t1", "Olympic Dam", -30.41, 136.84),
                    located("t2", "Olympic Dam", -30.49, 136.86),
                    located("far", "Olympic Dam", -30.70, 136.86)));

            assertEquals(List.of(List.of("d1", "d2"), List.of("t1", "t2")), ids(groups));
        }

        @Test
        @DisplayName("Groups are closed transitively")
        void transitive() {
            // a~b and b~c on name similarity, a and c alone are too different
            FacilityRecord a = located("a", "aaaaaaaxxx", 45.500, -109.80);
            FacilityRecord b = located("b", "aaaaaaayyy", 45.503, -109.80);
            FacilityRecord c = located("c", "zzzaaaayyy", 45.506, -109.80);
            assertFalse(grouper.isDuplicate(a, c));

            List<List<FacilityRecord>> groups = grouper.findDuplicateGroups(List.of(c, a, b));

            assertEquals(List.of(List.of("c", "a", "b")), ids(groups));
        }

        @Test
        @DisplayName("Singletons are not reported and groups keep input order")
        void ordering() {
            List<List<FacilityRecord>> groups = grouper.findDuplicateGroups(List.of(
                    located("x", "Lonely Mill", 10.0, 10.0),
                    located("p2", "Prominent Hill", -29.18, 135.52),
                    located("s1", "Stillwater Mine", 45.50, -109.80),
                    located("p1", "Prominent Hill Mine", -29.181, 135.521),
                    located("s2", "Stillwater Mine", 45.501, -109.801)));

            assertEquals(List.of(List.of("p2", "p1"), List.of("s1", "s2")), ids(groups));
        }

        @Test
        @DisplayName("Unlocated records are cross-checked by name and alias")
        void unlocatedCrossCheck() {
            List<List<FacilityRecord>> groups = grouper.findDuplicateGroups(List.of(
                    located("a", "Stillwater Mine", 45.50, -109.80),
                    unlocated("b", "STILLWATER MINE"),
                    unlocated("c", "Nye Complex", "Stillwater Mine"),
                    unlocated("d", "Kambalda")));

            assertEquals(List.of(List.of("a", "b", "c")), ids(groups));
        }

        @Test
        @DisplayName("Strict options leave unlocated records alone")
        void strictSkipsUnlocated() {
            DuplicateGrouper strict = new DuplicateGrouper(DeduplicationOptions.strict(), new IndelSimilarity());

            List<List<FacilityRecord>> groups = strict.findDuplicateGroups(List.of(
                    located("a", "Stillwater Mine", 45.50, -109.80),
                    unlocated("b", "Stillwater Mine")));

            assertTrue(groups.isEmpty());
        }

        @Test
        @DisplayName("Repeated runs give identical groups")
        void deterministic() {
            List<FacilityRecord> records = List.of(
                    located("s1", "Stillwater Mine", 45.50, -109.80),
                    located("p1", "Prominent Hill Mine", -29.181, 135.521),
                    located("s2", "Stillwater Mine", 45.501, -109.801),
                    located("p2", "Prominent Hill", -29.18, 135.52),
                    unlocated("s3", "Stillwater Mine"));

            assertEquals(ids(grouper.findDuplicateGroups(records)), ids(grouper.findDuplicateGroups(records)));
        }

        @Test
        @DisplayName("Malformed records are skipped and counted")
        void malformedSkipped() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            DuplicateGrouper metered = new DuplicateGrouper(DeduplicationOptions.defaults(), new IndelSimilarity(),
                    new MicrometerMetricsService(registry));

            List<List<FacilityRecord>> groups = metered.findDuplicateGroups(Arrays.asList(
                    located("a", "Stillwater Mine", 45.50, -109.80),
                    located("bad", " ", 45.50, -109.80),
                    null,
                    located("b", "Stillwater Mine", 45.501, -109.801)));

            assertEquals(List.of(List.of("a", "b")), ids(groups));
            assertEquals(2.0, registry.get("facility.records.skipped").counter().count());
            assertEquals(1.0, registry.get("facility.groups.found").summary().totalAmount());
        }
    }
}

package com.facility.resolution.slug;

import com.facility.resolution.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SlugRegistry Tests")
class SlugRegistryTest {

    private SlugRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SlugRegistry();
    }

    @Test
    @DisplayName("Repeated base slug gets numeric suffixes from 2")
    void numericSuffixes() {
        assertEquals("abc-mine", registry.unique("abc-mine"));
        assertEquals("abc-mine-2", registry.unique("abc-mine"));
        assertEquals("abc-mine-3", registry.unique("abc-mine"));
        assertEquals(3, registry.size());
    }

    @Test
    @DisplayName("Collisions try region, town and geohash before numbers")
    void disambiguationOrder() {
        assertEquals("stillwater-mine", registry.unique("stillwater-mine", "Montana", "Nye", "c8x2"));
        assertEquals("stillwater-mine-montana", registry.unique("stillwater-mine", "Montana", "Nye", "c8x2"));
        assertEquals("stillwater-mine-nye", registry.unique("stillwater-mine", "Montana", "Nye", "c8x2"));
        assertEquals("stillwater-mine-c8x2", registry.unique("stillwater-mine", "Montana", "Nye", "c8x2"));
        assertEquals("stillwater-mine-2", registry.unique("stillwater-mine", "Montana", "Nye", "c8x2"));
    }

    @Test
    @DisplayName("Blank disambiguators are skipped")
    void blankDisambiguators() {
        registry.unique("escondida-mine");
        assertEquals("escondida-mine-antofagasta", registry.unique("escondida-mine", " ", "Antofagasta", null));
    }

    @Test
    @DisplayName("Seeded slugs are never reissued")
    void seeded() {
        registry.loadExisting(List.of("abc-mine", "abc-mine-2", " "));

        assertEquals("abc-mine-3", registry.unique("abc-mine"));
        assertTrue(registry.contains("abc-mine-2"));
        assertFalse(registry.contains(" "));
    }

    @Test
    @DisplayName("Numeric counter skips taken values")
    void skipsTaken() {
        registry.loadExisting(List.of("pit", "pit-3"));

        assertEquals("pit-2", registry.unique("pit"));
        assertEquals("pit-4", registry.unique("pit"));
    }

    @Test
    @DisplayName("Blank base falls back to the default slug")
    void blankBase() {
        assertEquals("facility", registry.unique(""));
        assertEquals("facility-2", registry.unique(null));
    }

    @Test
    @DisplayName("Same request sequence gives the same slugs")
    void deterministic() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        SlugRegistry other = new SlugRegistry();
        for (int i = 0; i < 5; i++) {
            first.add(registry.unique("kalgoorlie-mill", i % 2 == 0 ? "WA" : null, null, "qe6"));
            second.add(other.unique("kalgoorlie-mill", i % 2 == 0 ? "WA" : null, null, "qe6"));
        }

        assertEquals(first, second);
        assertEquals(List.of("kalgoorlie-mill", "kalgoorlie-mill-qe6", "kalgoorlie-mill-wa",
                "kalgoorlie-mill-2", "kalgoorlie-mill-3"), first);
    }

    @Test
    @DisplayName("Snapshot lists slugs in reservation order")
    void snapshot() {
        registry.loadExisting(List.of("b"));
        registry.unique("a");

        assertEquals(List.of("b", "a"), new ArrayList<>(registry.snapshot()));
        assertThrows(UnsupportedOperationException.class, () -> registry.snapshot().add("c"));
    }

    @Test
    @DisplayName("Collisions are counted")
    void collisionMetric() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        SlugRegistry metered = new SlugRegistry(new MicrometerMetricsService(meters));

        metered.unique("x");
        metered.unique("x");
        metered.unique("x", "Region", null, null);

        assertEquals(2.0, meters.get("facility.slug.collision").counter().count());
    }
}

package com.facility.resolution.slug;

import com.facility.resolution.metrics.MetricsService;
import com.facility.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Hands out corpus-wide unique canonical slugs for one batch run.
 *
 * <p>Seed the registry with every slug already assigned in the corpus ({@link #loadExisting})
 * before issuing new ones. On collision the base slug is disambiguated in a fixed order:
 * region, town, geohash prefix, then a numeric suffix starting at 2. The numeric path always
 * terminates, so {@link #unique} never fails.</p>
 *
 * <p>Not thread-safe. Use one instance per batch.</p>
 */
public class SlugRegistry {
    private static final Logger log = LoggerFactory.getLogger(SlugRegistry.class);

    private final Set<String> seen = new LinkedHashSet<>();
    private final Map<String, Integer> numericSuffixes = new HashMap<>();
    private final MetricsService metricsService;

    public SlugRegistry() {
        this(new NoOpMetricsService());
    }

    public SlugRegistry(MetricsService metricsService) {
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Reserves slugs that are already assigned elsewhere in the corpus. Blank entries are ignored.
     */
    public void loadExisting(Collection<String> slugs) {
        int before = seen.size();
        for (String slug : slugs) {
            if (slug != null && !slug.isBlank()) {
                seen.add(slug);
            }
        }
        log.debug("Loaded {} existing slugs", seen.size() - before);
    }

    public String unique(String baseSlug) {
        return unique(baseSlug, null, null, null);
    }

    /**
     * Reserves and returns a slug not issued before. The first request for a base slug gets it unchanged.
     *
     * @param baseSlug      proposed slug; blank becomes {@value Slugs#FALLBACK}
     * @param region        first disambiguator, may be null
     * @param town          second disambiguator, may be null
     * @param geohashPrefix third disambiguator, may be null
     */
    public String unique(String baseSlug, String region, String town, String geohashPrefix) {
        String base = baseSlug == null || baseSlug.isBlank() ? Slugs.FALLBACK : baseSlug;
        if (seen.add(base)) {
            return base;
        }
        metricsService.incrementSlugCollision();

        for (String disambiguator : new String[]{region, town, geohashPrefix}) {
            String suffix = Slugs.slugifySuffix(disambiguator);
            if (!suffix.isEmpty()) {
                String candidate = base + "-" + suffix;
                if (seen.add(candidate)) {
                    log.debug("Slug collision on '{}' resolved as '{}'", base, candidate);
                    return candidate;
                }
            }
        }

        int counter = numericSuffixes.getOrDefault(base, 1);
        String candidate;
        do {
            counter++;
            candidate = base + "-" + counter;
        } while (!seen.add(candidate));
        numericSuffixes.put(base, counter);
        log.debug("Slug collision on '{}' resolved as '{}'", base, candidate);
        return candidate;
    }

    public boolean contains(String slug) {
        return seen.contains(slug);
    }

    public int size() {
        return seen.size();
    }

    /**
     * All reserved slugs in reservation order.
     */
    public Set<String> snapshot() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(seen));
    }
}

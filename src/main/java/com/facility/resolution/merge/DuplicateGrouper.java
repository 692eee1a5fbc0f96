package com.facility.resolution.merge;

import com.facility.resolution.api.DeduplicationOptions;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.validation.RecordValidator;
import com.facility.resolution.metrics.MetricsService;
import com.facility.resolution.metrics.NoOpMetricsService;
import com.facility.resolution.similarity.StringSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Partitions a batch of records into groups of duplicates.
 *
 * <p>Located records are bucketed by rounded coordinates and compared pairwise with a two-tier
 * rule, each against its own bucket and the neighbouring buckets a tier delta can reach. Unlocated records are cross-checked by name and alias equality.
 * Duplicate edges are closed transitively, so groups are connected components.</p>
 */
public class DuplicateGrouper {
    private static final Logger log = LoggerFactory.getLogger(DuplicateGrouper.class);

    private final DeduplicationOptions options;
    private final StringSimilarity similarity;
    private final MetricsService metricsService;

    public DuplicateGrouper(DeduplicationOptions options, StringSimilarity similarity) {
        this(options, similarity, new NoOpMetricsService());
    }

    public DuplicateGrouper(DeduplicationOptions options, StringSimilarity similarity,
                            MetricsService metricsService) {
        this.options = options;
        this.similarity = similarity;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Pairwise duplicate test. Symmetric in its arguments.
     */
    public boolean isDuplicate(FacilityRecord a, FacilityRecord b) {
        if (a.hasCoordinates() && b.hasCoordinates()) {
            return matchesTier(a, b);
        }
        return options.isCrossCheckUnlocated() && sharesName(a, b);
    }

    /**
     * Finds duplicate groups of two or more records. Malformed records are skipped.
     * Groups are ordered by their earliest member; members keep input order.
     */
    public List<List<FacilityRecord>> findDuplicateGroups(Collection<FacilityRecord> records) {
        List<FacilityRecord> valid = RecordValidator.filterValid(records,
                e -> metricsService.incrementRecordsSkipped());
        int n = valid.size();
        UnionFind components = new UnionFind(n);

        Map<Cell, List<Integer>> buckets = new LinkedHashMap<>();
        double scale = Math.pow(10, options.getBucketDecimals());
        for (int i = 0; i < n; i++) {
            FacilityRecord record = valid.get(i);
            if (record.hasCoordinates()) {
                Cell cell = new Cell(Math.round(record.getLat() * scale), Math.round(record.getLon() * scale));
                buckets.computeIfAbsent(cell, k -> new ArrayList<>()).add(i);
            }
        }

        // A pair within the widest tier delta can sit at most this many cells apart on each axis.
        int reach = (int) Math.ceil(
                Math.max(options.getTier1CoordinateDelta(), options.getTier2CoordinateDelta()) * scale);
        int comparisons = 0;
        for (Map.Entry<Cell, List<Integer>> entry : buckets.entrySet()) {
            Cell cell = entry.getKey();
            for (long dLat = -reach; dLat <= reach; dLat++) {
                for (long dLon = -reach; dLon <= reach; dLon++) {
                    List<Integer> neighbour = buckets.get(new Cell(cell.lat() + dLat, cell.lon() + dLon));
                    if (neighbour == null) {
                        continue;
                    }
                    for (int i : entry.getValue()) {
                        for (int j : neighbour) {
                            if (j <= i) {
                                continue;
                            }
                            comparisons++;
                            if (matchesTier(valid.get(i), valid.get(j))) {
                                components.union(i, j);
                            }
                        }
                    }
                }
            }
        }

        if (options.isCrossCheckUnlocated()) {
            crossCheckUnlocated(valid, components);
        }

        Map<Integer, List<FacilityRecord>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            byRoot.computeIfAbsent(components.find(i), k -> new ArrayList<>()).add(valid.get(i));
        }
        List<List<FacilityRecord>> groups = new ArrayList<>();
        for (List<FacilityRecord> group : byRoot.values()) {
            if (group.size() > 1) {
                groups.add(List.copyOf(group));
            }
        }

        log.info("Found {} duplicate groups among {} records ({} buckets, {} comparisons)",
                groups.size(), n, buckets.size(), comparisons);
        metricsService.recordDuplicateGroups(groups.size());
        return groups;
    }

    private boolean matchesTier(FacilityRecord a, FacilityRecord b) {
        double latDelta = Math.abs(a.getLat() - b.getLat());
        double lonDelta = Math.abs(a.getLon() - b.getLon());
        boolean tier1Close = latDelta < options.getTier1CoordinateDelta() && lonDelta < options.getTier1CoordinateDelta();
        boolean tier2Close = latDelta < options.getTier2CoordinateDelta() && lonDelta < options.getTier2CoordinateDelta();
        if (!tier1Close && !tier2Close) {
            return false;
        }

        String nameA = lower(a.getName());
        String nameB = lower(b.getName());
        if (containsShorter(nameA, nameB)) {
            return true;
        }
        double ratio = similarity.ratio(nameA, nameB);
        return (tier1Close && ratio > options.getTier1NameSimilarity())
                || (tier2Close && ratio > options.getTier2NameSimilarity());
    }

    private static boolean containsShorter(String a, String b) {
        String shorter = a.length() < b.length() ? a : b;
        String longer = a.length() < b.length() ? b : a;
        return longer.contains(shorter);
    }

    private static boolean sharesName(FacilityRecord a, FacilityRecord b) {
        String nameA = lower(a.getName());
        String nameB = lower(b.getName());
        return nameA.equals(nameB) || hasAlias(b, nameA) || hasAlias(a, nameB);
    }

    private static boolean hasAlias(FacilityRecord record, String lowerName) {
        for (String alias : record.getAliases()) {
            if (lower(alias).equals(lowerName)) {
                return true;
            }
        }
        return false;
    }

    private static void crossCheckUnlocated(List<FacilityRecord> valid, UnionFind components) {
        Map<String, List<Integer>> byName = new HashMap<>();
        Map<String, List<Integer>> byAlias = new HashMap<>();
        for (int i = 0; i < valid.size(); i++) {
            FacilityRecord record = valid.get(i);
            byName.computeIfAbsent(lower(record.getName()), k -> new ArrayList<>()).add(i);
            for (String alias : record.getAliases()) {
                byAlias.computeIfAbsent(lower(alias), k -> new ArrayList<>()).add(i);
            }
        }

        for (int i = 0; i < valid.size(); i++) {
            FacilityRecord record = valid.get(i);
            if (record.hasCoordinates()) {
                continue;
            }
            String name = lower(record.getName());
            unionAll(components, i, byName.get(name));
            unionAll(components, i, byAlias.get(name));
            for (String alias : record.getAliases()) {
                unionAll(components, i, byName.get(lower(alias)));
            }
        }
    }

    private static void unionAll(UnionFind components, int i, List<Integer> others) {
        if (others == null) {
            return;
        }
        for (int j : others) {
            if (j != i) {
                components.union(i, j);
            }
        }
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private record Cell(long lat, long lon) {}

    /**
     * Disjoint sets over record indices. The smaller index becomes the root, so component
     * identity does not depend on union order.
     */
    static final class UnionFind {
        private final int[] parent;

        UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        int find(int i) {
            while (parent[i] != i) {
                parent[i] = parent[parent[i]];
                i = parent[i];
            }
            return i;
        }

        void union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA == rootB) {
                return;
            }
            if (rootA < rootB) {
                parent[rootB] = rootA;
            } else {
                parent[rootA] = rootB;
            }
        }
    }
}

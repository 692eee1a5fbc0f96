package com.facility.resolution.match;

import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.validation.RecordValidator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only snapshot of the corpus that strategies match against.
 *
 * <p>Malformed records are dropped on construction. The remaining records keep their input
 * order, which every lookup preserves, so results are deterministic. Coordinates are packed
 * into primitive arrays for batch distance computation.</p>
 */
public final class FacilityCorpus {

    private final List<FacilityRecord> records;
    private final Map<String, List<FacilityRecord>> byLowerName;
    private final Map<String, List<AliasHit>> byLowerAlias;
    private final Map<String, List<FacilityRecord>> byOperator;
    private final Map<String, List<FacilityRecord>> byExternalRef;
    private final FacilityRecord[] located;
    private final double[] lats;
    private final double[] lons;

    private FacilityCorpus(List<FacilityRecord> records) {
        this.records = Collections.unmodifiableList(records);
        this.byLowerName = new HashMap<>();
        this.byLowerAlias = new HashMap<>();
        this.byOperator = new HashMap<>();
        this.byExternalRef = new HashMap<>();

        List<FacilityRecord> withCoordinates = new ArrayList<>();
        for (FacilityRecord record : records) {
            byLowerName.computeIfAbsent(lower(record.getName()), k -> new ArrayList<>()).add(record);
            for (String alias : record.getAliases()) {
                byLowerAlias.computeIfAbsent(lower(alias), k -> new ArrayList<>()).add(new AliasHit(record, alias));
            }
            String operatorId = record.getOperatorCompanyId();
            if (operatorId != null) {
                byOperator.computeIfAbsent(operatorId, k -> new ArrayList<>()).add(record);
            }
            if (record.getExternalRefId() != null) {
                byExternalRef.computeIfAbsent(record.getExternalRefId(), k -> new ArrayList<>()).add(record);
            }
            if (record.hasCoordinates()) {
                withCoordinates.add(record);
            }
        }

        freeze(byLowerName);
        freeze(byLowerAlias);
        freeze(byOperator);
        freeze(byExternalRef);

        this.located = withCoordinates.toArray(new FacilityRecord[0]);
        this.lats = new double[located.length];
        this.lons = new double[located.length];
        for (int i = 0; i < located.length; i++) {
            lats[i] = located[i].getLat();
            lons[i] = located[i].getLon();
        }
    }

    /**
     * Builds a corpus from the given records, skipping malformed ones.
     */
    public static FacilityCorpus of(Collection<FacilityRecord> records) {
        return new FacilityCorpus(RecordValidator.filterValid(records));
    }

    public static FacilityCorpus empty() {
        return new FacilityCorpus(List.of());
    }

    public List<FacilityRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<FacilityRecord> findByName(String name) {
        return byLowerName.getOrDefault(lower(name), List.of());
    }

    /**
     * Records with an alias equal to {@code name}, ignoring case.
     */
    public List<AliasHit> findByAlias(String name) {
        return byLowerAlias.getOrDefault(lower(name), List.of());
    }

    public List<FacilityRecord> findByOperator(String companyId) {
        return companyId == null ? List.of() : byOperator.getOrDefault(companyId, List.of());
    }

    public List<FacilityRecord> findByExternalRef(String externalRefId) {
        return externalRefId == null ? List.of() : byExternalRef.getOrDefault(externalRefId, List.of());
    }

    /**
     * Records with coordinates, index-aligned with {@link #latitudes()} and {@link #longitudes()}.
     * The arrays are shared with the snapshot and must not be written to.
     */
    FacilityRecord[] located() {
        return located;
    }

    double[] latitudes() {
        return lats;
    }

    double[] longitudes() {
        return lons;
    }

    private static <T> void freeze(Map<String, List<T>> index) {
        index.replaceAll((key, hits) -> Collections.unmodifiableList(hits));
    }

    static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * A record together with the spelling of the alias that matched.
     */
    public record AliasHit(FacilityRecord record, String alias) {}
}

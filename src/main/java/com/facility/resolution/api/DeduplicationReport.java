package com.facility.resolution.api;

import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.merge.MergeResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a full deduplication pass. Nothing has been persisted: the caller writes the
 * survivors and deletes the absorbed records.
 *
 * @param merges     one result per duplicate group, in group order
 * @param skippedIds ids of malformed records left out of the pass
 * @param inputCount number of records submitted
 */
public record DeduplicationReport(
        List<MergeResult> merges,
        List<String> skippedIds,
        int inputCount
) {
    public DeduplicationReport {
        merges = merges != null ? List.copyOf(merges) : List.of();
        skippedIds = skippedIds != null ? List.copyOf(skippedIds) : List.of();
    }

    public List<FacilityRecord> survivors() {
        return merges.stream().map(MergeResult::canonical).toList();
    }

    /**
     * Every absorbed id across all groups, in group order.
     */
    public List<String> absorbedIds() {
        List<String> ids = new ArrayList<>();
        for (MergeResult merge : merges) {
            ids.addAll(merge.absorbedIds());
        }
        return List.copyOf(ids);
    }

    public boolean hasDuplicates() {
        return !merges.isEmpty();
    }

    @Override
    public String toString() {
        return "DeduplicationReport{" +
                "input=" + inputCount +
                ", groups=" + merges.size() +
                ", absorbed=" + absorbedIds().size() +
                ", skipped=" + skippedIds.size() +
                '}';
    }
}

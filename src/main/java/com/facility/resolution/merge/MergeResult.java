package com.facility.resolution.merge;

import com.facility.resolution.core.model.FacilityRecord;

import java.util.List;

/**
 * Outcome of folding a duplicate group into its survivor.
 *
 * <p>The engine persists nothing: the caller writes {@code canonical} and deletes the
 * records named by {@code absorbedIds}.</p>
 *
 * @param canonical     the merged survivor
 * @param absorbedIds   ids of the records folded into the survivor, in group order
 * @param survivorScore completeness score the survivor was selected with
 */
public record MergeResult(
        FacilityRecord canonical,
        List<String> absorbedIds,
        double survivorScore
) {
    public MergeResult {
        absorbedIds = absorbedIds != null ? List.copyOf(absorbedIds) : List.of();
    }

    /**
     * Result for a group with a single distinct record.
     */
    public static MergeResult unchanged(FacilityRecord record, double score) {
        return new MergeResult(record, List.of(), score);
    }

    public boolean isNoOp() {
        return absorbedIds.isEmpty();
    }
}

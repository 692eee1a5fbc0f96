package com.facility.resolution.api;

import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.slug.CanonicalName;

/**
 * Canonical name and slug computed for one record.
 */
public record SlugAssignment(String facilityId, CanonicalName canonicalName, String slug) {

    /**
     * Returns a copy of {@code record} carrying this assignment. The given record is not modified.
     */
    public FacilityRecord applyTo(FacilityRecord record) {
        if (!record.getFacilityId().equals(facilityId)) {
            throw new IllegalArgumentException("Assignment for " + facilityId
                    + " cannot be applied to " + record.getFacilityId());
        }
        return FacilityRecord.builder(record)
                .canonicalName(canonicalName.canonicalName())
                .canonicalSlug(slug)
                .build();
    }
}

package com.facility.resolution.match;

import com.facility.resolution.core.model.ExternalFacility;

import java.util.List;

/**
 * External canonical facility dataset used by the cross-reference strategy.
 * Loading it is the caller's concern; the core only reads the entries.
 */
public interface ExternalFacilityDataset {

    List<ExternalFacility> entries();

    default boolean isEmpty() {
        return entries().isEmpty();
    }

    static ExternalFacilityDataset empty() {
        return List::of;
    }
}

package com.facility.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Entry of an external canonical facility dataset, used only as matching evidence.
 */
public record ExternalFacility(
        String id,
        String name,
        Double lat,
        Double lon,
        List<String> commodities,
        String companyId
) {
    public ExternalFacility {
        Objects.requireNonNull(id, "id is required");
        commodities = commodities != null ? List.copyOf(commodities) : List.of();
    }

    public static ExternalFacility of(String id, String name) {
        return new ExternalFacility(id, name, null, null, List.of(), null);
    }
}

package com.facility.resolution.match;

import com.facility.resolution.core.model.ExternalFacility;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * List-backed {@link ExternalFacilityDataset}. Entries with a repeated id keep the first occurrence.
 */
public class InMemoryExternalFacilityDataset implements ExternalFacilityDataset {

    private final List<ExternalFacility> entries;

    public InMemoryExternalFacilityDataset(Collection<ExternalFacility> entries) {
        Map<String, ExternalFacility> byId = new LinkedHashMap<>();
        for (ExternalFacility entry : entries) {
            byId.putIfAbsent(entry.id(), entry);
        }
        this.entries = Collections.unmodifiableList(new ArrayList<>(byId.values()));
    }

    @Override
    public List<ExternalFacility> entries() {
        return entries;
    }
}

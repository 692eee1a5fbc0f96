package com.facility.resolution.tracing;

/**
 * The resolution operations that are traced, each with its span name.
 */
public enum SpanOperation {
    FIND_DUPLICATES("facility.findDuplicates"),
    FIND_DUPLICATE_GROUPS("facility.findDuplicateGroups"),
    MERGE_GROUP("facility.mergeGroup"),
    ASSIGN_CANONICAL_NAMES("facility.assignCanonicalNames"),
    DEDUPLICATE("facility.deduplicate");

    private final String spanName;

    SpanOperation(String spanName) {
        this.spanName = spanName;
    }

    public String spanName() {
        return spanName;
    }
}

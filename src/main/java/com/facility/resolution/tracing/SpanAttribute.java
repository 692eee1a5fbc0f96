package com.facility.resolution.tracing;

/**
 * Attribute keys recorded on resolution spans.
 */
public enum SpanAttribute {
    /** Id of the query record, or of the merge survivor. */
    FACILITY_ID("facility.id"),
    CORPUS_SIZE("facility.corpus.size"),
    CANDIDATES("facility.candidates"),
    RECORDS("facility.records"),
    GROUPS("facility.groups"),
    GROUP_SIZE("facility.group.size"),
    ABSORBED("facility.absorbed"),
    ASSIGNED("facility.slugs.assigned");

    private final String key;

    SpanAttribute(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}

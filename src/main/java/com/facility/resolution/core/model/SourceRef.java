package com.facility.resolution.core.model;

import java.util.Objects;

/**
 * Provenance entry. Two entries are the same source when {@code (type, id)} match.
 */
public record SourceRef(String type, String id, String url, String date) {

    public SourceRef {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(id, "id is required");
    }

    public static SourceRef of(String type, String id) {
        return new SourceRef(type, id, null, null);
    }

    public Key key() {
        return new Key(type, id);
    }

    public record Key(String type, String id) {}
}

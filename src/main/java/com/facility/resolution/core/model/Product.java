package com.facility.resolution.core.model;

import java.util.Objects;

/**
 * A product stream of a facility (e.g. copper cathode).
 */
public record Product(String stream, String unit) {

    public Product {
        Objects.requireNonNull(stream, "stream is required");
    }
}

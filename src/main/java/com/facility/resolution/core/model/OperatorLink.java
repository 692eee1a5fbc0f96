package com.facility.resolution.core.model;

import java.util.Objects;

/**
 * Weak reference to the operating company. The company entity itself is never loaded.
 */
public record OperatorLink(String companyId, double confidence) {

    public OperatorLink {
        Objects.requireNonNull(companyId, "companyId is required");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }
}

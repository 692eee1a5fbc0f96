package com.facility.resolution.core.model;

import java.util.Objects;

/**
 * Weak reference to an owning company.
 *
 * @param companyId  company identifier
 * @param role       ownership role (owner, joint_venture, ...)
 * @param percentage ownership share, if known
 * @param confidence confidence in the link
 */
public record OwnerLink(String companyId, String role, Double percentage, double confidence) {

    public OwnerLink {
        Objects.requireNonNull(companyId, "companyId is required");
        if (percentage != null && !(percentage >= 0.0 && percentage <= 100.0)) {
            throw new IllegalArgumentException("percentage must be between 0 and 100");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }
}

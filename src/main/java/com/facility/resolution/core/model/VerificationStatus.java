package com.facility.resolution.core.model;

import java.util.Locale;

/**
 * How a facility record was verified.
 */
public enum VerificationStatus {
    HUMAN_VERIFIED,
    CSV_IMPORTED,
    LLM_VERIFIED,
    LLM_SUGGESTED,
    UNVERIFIED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value such as {@code "csv_imported"}; unknown values map to {@link #UNVERIFIED}.
     */
    public static VerificationStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNVERIFIED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNVERIFIED;
        }
    }
}

package com.facility.resolution.core.model;

import java.util.Locale;

/**
 * How precisely a facility's coordinates pin down the physical site.
 */
public enum LocationPrecision {
    SITE,
    TOWN,
    REGION,
    COUNTRY,
    UNKNOWN;

    /**
     * Parses a wire value such as {@code "site"}. Unrecognized or null values map to {@link #UNKNOWN}.
     */
    public static LocationPrecision fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}

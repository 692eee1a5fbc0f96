package com.facility.resolution.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * An unresolved company name mentioned alongside a facility by some source.
 */
public record CompanyMention(String name, String role, double confidence, String source) {

    public CompanyMention {
        Objects.requireNonNull(name, "name is required");
    }

    public static CompanyMention of(String name, double confidence) {
        return new CompanyMention(name, null, confidence, null);
    }

    public String key() {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}

package com.facility.resolution.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A metal or mineral produced at a facility.
 *
 * @param metal           commodity name, compared case-insensitively
 * @param primary         whether this is the facility's primary commodity
 * @param chemicalFormula optional chemical formula (e.g. {@code Cu})
 */
public record Commodity(String metal, boolean primary, String chemicalFormula) {

    public Commodity {
        Objects.requireNonNull(metal, "metal is required");
    }

    public static Commodity of(String metal) {
        return new Commodity(metal, false, null);
    }

    public static Commodity primary(String metal) {
        return new Commodity(metal, true, null);
    }

    /**
     * Case-normalized key used for uniqueness.
     */
    public String key() {
        return metal.trim().toLowerCase(Locale.ROOT);
    }

    public boolean hasFormula() {
        return chemicalFormula != null && !chemicalFormula.isBlank();
    }
}

package com.facility.resolution.core.model;

import java.time.Instant;

/**
 * Verification state of a facility record.
 */
public record Verification(
        VerificationStatus status,
        double confidence,
        Instant lastChecked,
        String notes
) {
    public Verification {
        if (status == null) {
            status = VerificationStatus.UNVERIFIED;
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public static Verification unverified() {
        return new Verification(VerificationStatus.UNVERIFIED, 0.0, null, null);
    }

    public static Verification of(VerificationStatus status, double confidence) {
        return new Verification(status, confidence, null, null);
    }

    /**
     * Returns a copy with {@code note} appended to the existing notes, separated by {@code "; "}.
     */
    public Verification withAppendedNote(String note) {
        String merged = notes == null || notes.isBlank() ? note : notes + "; " + note;
        return new Verification(status, confidence, lastChecked, merged);
    }
}

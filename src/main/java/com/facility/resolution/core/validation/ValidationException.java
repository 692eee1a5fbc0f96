package com.facility.resolution.core.validation;

/**
 * Runtime exception raised when a facility record is malformed or corrupt.
 * Always names the offending facility id (which may itself be null when the id is missing).
 */
public class ValidationException extends RuntimeException {

    private final String facilityId;

    public ValidationException(String facilityId, String message) {
        super(format(facilityId, message));
        this.facilityId = facilityId;
    }

    public ValidationException(String facilityId, String message, Throwable cause) {
        super(format(facilityId, message), cause);
        this.facilityId = facilityId;
    }

    public String getFacilityId() {
        return facilityId;
    }

    private static String format(String facilityId, String message) {
        return "Invalid facility record '" + facilityId + "': " + message;
    }
}

package com.facility.resolution.core.validation;

import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Boundary validation for records entering the resolution core.
 * Rejects records that cannot take part in matching or merging.
 */
public final class RecordValidator {
    private static final Logger log = LoggerFactory.getLogger(RecordValidator.class);

    /** Maximum allowed length for facility names. */
    public static final int MAX_NAME_LENGTH = 1000;

    private RecordValidator() {
        // utility class
    }

    /**
     * Validates a record.
     *
     * @throws ValidationException if the record is malformed
     */
    public static void validate(FacilityRecord record) {
        if (record == null) {
            throw new ValidationException(null, "record is null");
        }
        String id = record.getFacilityId();
        if (id == null || id.isBlank()) {
            throw new ValidationException(id, "facility_id is missing");
        }
        String name = record.getName();
        if (name == null || name.isBlank()) {
            throw new ValidationException(id, "name is missing");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException(id, "name exceeds maximum length of " + MAX_NAME_LENGTH);
        }
        Location location = record.getLocation();
        if (location != null && location.hasCoordinates()) {
            double lat = location.lat();
            double lon = location.lon();
            if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
                throw new ValidationException(id, "latitude out of range: " + lat);
            }
            if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
                throw new ValidationException(id, "longitude out of range: " + lon);
            }
        }
    }

    public static boolean isValid(FacilityRecord record) {
        try {
            validate(record);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Returns the valid records in input order. Malformed records are logged and skipped.
     */
    public static List<FacilityRecord> filterValid(Collection<FacilityRecord> records) {
        return filterValid(records, rejected -> { });
    }

    /**
     * Returns the valid records in input order, reporting each skipped record to {@code onSkipped}.
     */
    public static List<FacilityRecord> filterValid(Collection<FacilityRecord> records,
                                                   Consumer<ValidationException> onSkipped) {
        List<FacilityRecord> valid = new ArrayList<>(records.size());
        for (FacilityRecord record : records) {
            try {
                validate(record);
                valid.add(record);
            } catch (ValidationException e) {
                log.warn("Skipping malformed record: {}", e.getMessage());
                onSkipped.accept(e);
            }
        }
        return valid;
    }
}

package com.facility.resolution.core.model;

/**
 * Geographic position of a facility.
 * Latitude and longitude are either both present or both absent; present coordinates always
 * carry a precision.
 *
 * @param lat       latitude in decimal degrees, or null
 * @param lon       longitude in decimal degrees, or null
 * @param precision precision of the coordinates
 * @param town      nearest town, if known
 * @param region    administrative region (state/province), if known
 */
public record Location(
        Double lat,
        Double lon,
        LocationPrecision precision,
        String town,
        String region
) {
    public Location {
        if ((lat == null) != (lon == null)) {
            throw new IllegalArgumentException("lat and lon must be both present or both absent");
        }
        if (lat != null && precision == null) {
            precision = LocationPrecision.UNKNOWN;
        }
    }

    public static Location of(double lat, double lon) {
        return new Location(lat, lon, LocationPrecision.UNKNOWN, null, null);
    }

    public static Location of(double lat, double lon, LocationPrecision precision) {
        return new Location(lat, lon, precision, null, null);
    }

    public boolean hasCoordinates() {
        return lat != null;
    }

    public Location withPlace(String town, String region) {
        return new Location(lat, lon, precision, town, region);
    }
}

package com.facility.resolution.geo;

/**
 * Great-circle distances using the haversine formula on a sphere of radius 6371 km.
 *
 * <p>The batch form computes the distance from one point to many points in a single pass over
 * primitive arrays; the scalar form delegates to the same kernel, so both produce identical
 * results.</p>
 */
public final class DistanceCalculator {

    /** Mean Earth radius in kilometres. */
    public static final double EARTH_RADIUS_KM = 6371.0;

    private DistanceCalculator() {
        // utility class
    }

    /**
     * Distances in kilometres from {@code (lat, lon)} to each {@code (lats[i], lons[i])}.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static double[] distances(double lat, double lon, double[] lats, double[] lons) {
        if (lats.length != lons.length) {
            throw new IllegalArgumentException(
                    "Latitude and longitude arrays differ in length: " + lats.length + " vs " + lons.length);
        }
        double lat1 = Math.toRadians(lat);
        double lon1 = Math.toRadians(lon);
        double cosLat1 = Math.cos(lat1);

        double[] result = new double[lats.length];
        for (int i = 0; i < lats.length; i++) {
            result[i] = haversine(lat1, lon1, cosLat1, Math.toRadians(lats[i]), Math.toRadians(lons[i]));
        }
        return result;
    }

    /**
     * Distance in kilometres between two points.
     */
    public static double distance(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        return haversine(lat1Rad, Math.toRadians(lon1), Math.cos(lat1Rad),
                Math.toRadians(lat2), Math.toRadians(lon2));
    }

    private static double haversine(double lat1, double lon1, double cosLat1, double lat2, double lon2) {
        double sinHalfDLat = Math.sin((lat2 - lat1) / 2.0);
        double sinHalfDLon = Math.sin((lon2 - lon1) / 2.0);
        double a = sinHalfDLat * sinHalfDLat + cosLat1 * Math.cos(lat2) * sinHalfDLon * sinHalfDLon;
        // rounding can push a marginally above 1 for antipodal points
        double c = 2.0 * Math.asin(Math.sqrt(Math.min(1.0, a)));
        return EARTH_RADIUS_KM * c;
    }
}

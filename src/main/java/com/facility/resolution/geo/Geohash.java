package com.facility.resolution.geo;

/**
 * Standard base-32 geohash encoding.
 */
public final class Geohash {

    private static final char[] BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz".toCharArray();
    private static final int[] BITS = {16, 8, 4, 2, 1};

    private Geohash() {
        // utility class
    }

    /**
     * Encodes the coordinates with the given number of characters.
     *
     * @throws IllegalArgumentException if precision is not positive or coordinates are out of range
     */
    public static String encode(double lat, double lon, int precision) {
        if (precision <= 0) {
            throw new IllegalArgumentException("precision must be positive");
        }
        if (lat < -90.0 || lat > 90.0 || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("coordinates out of range: " + lat + ", " + lon);
        }
        double[] latInterval = {-90.0, 90.0};
        double[] lonInterval = {-180.0, 180.0};
        StringBuilder hash = new StringBuilder(precision);
        boolean even = true;
        int bit = 0;
        int ch = 0;

        while (hash.length() < precision) {
            if (even) {
                double mid = (lonInterval[0] + lonInterval[1]) / 2.0;
                if (lon > mid) {
                    ch |= BITS[bit];
                    lonInterval[0] = mid;
                } else {
                    lonInterval[1] = mid;
                }
            } else {
                double mid = (latInterval[0] + latInterval[1]) / 2.0;
                if (lat > mid) {
                    ch |= BITS[bit];
                    latInterval[0] = mid;
                } else {
                    latInterval[1] = mid;
                }
            }
            even = !even;
            if (bit < 4) {
                bit++;
            } else {
                hash.append(BASE32[ch]);
                bit = 0;
                ch = 0;
            }
        }
        return hash.toString();
    }
}

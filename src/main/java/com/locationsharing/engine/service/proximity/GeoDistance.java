package com.locationsharing.engine.service.proximity;

import com.locationsharing.engine.dto.LocationSample;

import java.util.Locale;

/**
 * Great-circle geometry on a spherical earth.
 *
 * Every distance in the engine goes through {@link #meters}, which uses the
 * haversine formula. The intermediate term is clamped to [0, 1] so that
 * antipodal or pole-adjacent coordinates cannot produce NaN from rounding.
 */
public final class GeoDistance {

    /** Mean earth radius (IUGG) in meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    private static final String[] DIRECTIONS = {"N", "NE", "E", "SE", "S", "SW", "W", "NW"};

    private GeoDistance() {
    }

    public static double meters(double lat1, double lng1, double lat2, double lng2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaPhi = Math.toRadians(lat2 - lat1);
        double deltaLambda = Math.toRadians(lng2 - lng1);

        double sinHalfPhi = Math.sin(deltaPhi / 2);
        double sinHalfLambda = Math.sin(deltaLambda / 2);
        double h = sinHalfPhi * sinHalfPhi
            + Math.cos(phi1) * Math.cos(phi2) * sinHalfLambda * sinHalfLambda;

        h = Math.max(0.0, Math.min(1.0, h));
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(h));
    }

    public static double meters(LocationSample from, LocationSample to) {
        return meters(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * Initial bearing from {@code from} to {@code to}, normalised to [0, 360).
     */
    public static double bearingDegrees(double lat1, double lng1, double lat2, double lng2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaLambda = Math.toRadians(lng2 - lng1);

        double y = Math.sin(deltaLambda) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2)
            - Math.sin(phi1) * Math.cos(phi2) * Math.cos(deltaLambda);

        double bearing = Math.toDegrees(Math.atan2(y, x));
        return (bearing + 360.0) % 360.0;
    }

    public static String cardinalDirection(double bearingDegrees) {
        int index = (int) Math.floor(((bearingDegrees % 360.0) + 22.5) / 45.0) % DIRECTIONS.length;
        return DIRECTIONS[index];
    }

    /**
     * Rounds a distance for display: exact meters below 100m, hundreds of
     * meters below 1km, one-decimal kilometers beyond.
     */
    public static String formatDistance(double meters) {
        if (meters < 100) {
            return Math.round(meters) + "m";
        } else if (meters < 1000) {
            return Math.round(meters / 100.0) * 100 + "m";
        }
        return String.format(Locale.ROOT, "%.1fkm", meters / 1000.0);
    }
}

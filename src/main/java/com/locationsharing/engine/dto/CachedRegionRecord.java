package com.locationsharing.engine.dto;

import com.locationsharing.engine.service.proximity.GeoDistance;

/**
 * Lightweight in-memory copy of a geofence region.
 *
 * The JPA entity carries a JTS geometry and persistence state; evaluation runs
 * on every peer update, so it works on this immutable snapshot instead.
 *
 * @param regionId     database id of the region
 * @param ownerId      user that created the region
 * @param label        human-readable label
 * @param latitude     center latitude
 * @param longitude    center longitude
 * @param radiusMeters region radius
 */
public record CachedRegionRecord(
    Long regionId,
    String ownerId,
    String label,
    double latitude,
    double longitude,
    double radiusMeters
) {

    /** Cap on the accuracy-based exit margin. */
    public static final double MAX_EXIT_MARGIN_METERS = 50.0;

    public double distanceTo(LocationSample sample) {
        return GeoDistance.meters(latitude, longitude, sample.latitude(), sample.longitude());
    }

    public boolean isInside(double distanceMeters) {
        return distanceMeters <= radiusMeters;
    }

    /**
     * A peer already inside only counts as leaving once it is further out than
     * the radius plus its own fix accuracy (capped), so GPS jitter at the
     * boundary does not flap ENTER/EXIT.
     */
    public boolean isOutsideWithMargin(double distanceMeters, double accuracyMeters) {
        return distanceMeters > radiusMeters + Math.min(accuracyMeters, MAX_EXIT_MARGIN_METERS);
    }

    public String toLogString() {
        return String.format("Region[id=%d, label=%s, radius=%.0fm]", regionId, label, radiusMeters);
    }
}

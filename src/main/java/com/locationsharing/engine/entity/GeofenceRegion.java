package com.locationsharing.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.locationtech.jts.geom.Point;

import java.time.LocalDateTime;

/**
 * Circular geofence region created by a user and evaluated on that user's
 * device against peers' locations.
 *
 * The center is a JTS Point that Hibernate Spatial maps to a PostGIS
 * geometry with SRID 4326 (WGS84). Note the JTS coordinate order:
 * x = longitude, y = latitude.
 *
 * Regions are soft-deleted through the {@code active} flag.
 */
@Entity
@Table(name = "geofence_regions", indexes = {
    @Index(name = "idx_region_owner_active", columnList = "owner_id, active"),
    @Index(name = "idx_region_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceRegion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * User that created the region
     */
    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    /**
     * Human-readable label (e.g. "Home", "Office")
     */
    @Column(nullable = false, length = 255)
    private String label;

    @Column(name = "center", columnDefinition = "geometry(Point,4326)", nullable = false)
    private Point center;

    @Column(name = "radius_meters", nullable = false)
    private Double radiusMeters;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public double getLatitude() {
        return center != null ? center.getY() : 0.0;
    }

    public double getLongitude() {
        return center != null ? center.getX() : 0.0;
    }
}

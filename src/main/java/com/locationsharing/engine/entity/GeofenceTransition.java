package com.locationsharing.engine.entity;

import com.locationsharing.engine.dto.GeofenceTransitionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * History entry of a peer entering or leaving a region.
 *
 * Region label and coordinates are denormalized so that history listings
 * need no join and survive region deletion.
 */
@Entity
@Table(
    name = "geofence_transitions",
    indexes = {
        @Index(name = "idx_transition_region", columnList = "region_id"),
        @Index(name = "idx_transition_peer", columnList = "peer_id"),
        @Index(name = "idx_transition_occurred_at", columnList = "occurred_at")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Format: {regionId}_{peerId}_{epochMillis}_{type}
     */
    @Column(name = "transition_id", nullable = false, unique = true)
    private String transitionId;

    @Column(name = "region_id", nullable = false)
    private Long regionId;

    @Column(name = "region_label", nullable = false)
    private String regionLabel;

    @Column(name = "peer_id", nullable = false, length = 100)
    private String peerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private GeofenceTransitionType type;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "distance_to_center")
    private Double distanceToCenter;

    /**
     * Capture time of the fix that caused the transition
     */
    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}

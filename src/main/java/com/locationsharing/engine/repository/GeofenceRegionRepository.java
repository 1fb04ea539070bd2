package com.locationsharing.engine.repository;

import com.locationsharing.engine.entity.GeofenceRegion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for GeofenceRegion entities.
 *
 * Evaluation never queries the database; regions are loaded into the
 * in-memory cache of {@code GeofenceService}.
 */
@Repository
public interface GeofenceRegionRepository extends JpaRepository<GeofenceRegion, Long> {

    /**
     * Used for cache warm-up and refresh.
     */
    List<GeofenceRegion> findByActiveTrue();

    List<GeofenceRegion> findByOwnerIdAndActiveTrue(String ownerId);

    long countByActiveTrue();
}

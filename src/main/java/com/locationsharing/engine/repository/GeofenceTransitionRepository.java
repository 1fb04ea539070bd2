package com.locationsharing.engine.repository;

import com.locationsharing.engine.entity.GeofenceTransition;
import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

@Repository
public interface GeofenceTransitionRepository extends JpaRepository<GeofenceTransition, Long> {

    List<GeofenceTransition> findByRegionIdOrderByOccurredAtDesc(Long regionId);

    /**
     * Transition history of one peer, most recent first.
     */
    List<GeofenceTransition> findByPeerIdOrderByOccurredAtDesc(String peerId);

    List<GeofenceTransition> findByOccurredAtAfterOrderByOccurredAtDesc(Instant since);
}

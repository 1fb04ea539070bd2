package com.locationsharing.engine.service.geofence;

import com.locationsharing.engine.dto.CachedRegionRecord;
import com.locationsharing.engine.dto.GeofenceRegionRequest;
import com.locationsharing.engine.dto.GeofenceTransitionRecord;
import com.locationsharing.engine.dto.GeofenceTransitionType;
import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.PeerPresenceView;
import com.locationsharing.engine.entity.GeofenceRegion;
import com.locationsharing.engine.entity.GeofenceTransition;
import com.locationsharing.engine.gateway.NotificationGateway;
import com.locationsharing.engine.repository.GeofenceRegionRepository;
import com.locationsharing.engine.repository.GeofenceTransitionRepository;
import com.locationsharing.engine.service.presence.PeerPresenceListener;
import com.locationsharing.engine.service.presence.PresenceSubscription;
import com.locationsharing.engine.service.presence.PresenceSyncEngine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-point alerts: tells the local user when a peer enters or leaves one of
 * the user's regions.
 *
 * Regions live in PostGIS but are evaluated from an in-memory cache that is
 * warmed at start-up, refreshed on a schedule, and refreshed immediately when
 * a region is created or deleted. Evaluation runs on the tracking worker for
 * each peer view change; persistence of transitions is handed to the
 * maintenance executor so the worker never waits on the database.
 *
 * Transitions:
 * - ENTER when the peer's distance to the center is <= radius
 * - EXIT when a peer known to be inside is further than radius + min(accuracy, 50m)
 * - a peer going offline, or stopping sharing, produces no transition
 */
@Slf4j
@Service
public class GeofenceService implements PeerPresenceListener {

    private static final int WGS84_SRID = 4326;

    private final GeofenceRegionRepository regionRepository;
    private final GeofenceTransitionRepository transitionRepository;
    private final PresenceSyncEngine presence;
    private final NotificationGateway notifications;
    private final Executor persistenceExecutor;

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), WGS84_SRID);
    private final Map<String, Boolean> insideState = new ConcurrentHashMap<>();
    private volatile List<CachedRegionRecord> regions = List.of();
    private PresenceSubscription subscription;

    public GeofenceService(
        GeofenceRegionRepository regionRepository,
        GeofenceTransitionRepository transitionRepository,
        PresenceSyncEngine presence,
        NotificationGateway notifications,
        @Qualifier("taskScheduler") Executor persistenceExecutor
    ) {
        this.regionRepository = regionRepository;
        this.transitionRepository = transitionRepository;
        this.presence = presence;
        this.notifications = notifications;
        this.persistenceExecutor = persistenceExecutor;
    }

    /**
     * Loads the region cache before peer updates start arriving.
     */
    @PostConstruct
    public void warmUpCache() {
        log.info("Starting region cache warm-up...");
        long startTime = System.currentTimeMillis();
        try {
            int cached = refreshRegions();
            log.info("Region cache warm-up completed: {} regions cached in {}ms",
                cached, System.currentTimeMillis() - startTime);
        } catch (DataAccessException e) {
            // Evaluation stays idle until the scheduled refresh succeeds.
            log.error("Region cache warm-up failed", e);
        }
        subscription = presence.subscribeAll(this);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.cancel();
        }
    }

    @Scheduled(fixedRateString = "${location-sharing.geofence.refresh-interval-minutes:30}",
               timeUnit = TimeUnit.MINUTES,
               initialDelay = 30)
    public void scheduledCacheRefresh() {
        try {
            int refreshed = refreshRegions();
            log.info("Scheduled region cache refresh completed: {} regions", refreshed);
        } catch (DataAccessException e) {
            log.error("Scheduled region cache refresh failed", e);
        }
    }

    /**
     * Reloads every active region from the database.
     *
     * @return number of regions cached
     */
    public int refreshRegions() {
        List<CachedRegionRecord> loaded = regionRepository.findByActiveTrue().stream()
            .map(GeofenceService::toCached)
            .toList();
        regions = loaded;

        insideState.keySet().removeIf(key -> loaded.stream()
            .noneMatch(region -> key.startsWith(region.regionId() + "|")));
        log.debug("Cached {} regions", loaded.size());
        return loaded.size();
    }

    public List<CachedRegionRecord> cachedRegions() {
        return regions;
    }

    @Transactional
    public GeofenceRegion createRegion(GeofenceRegionRequest request) {
        GeofenceRegion region = GeofenceRegion.builder()
            .ownerId(request.ownerId())
            .label(request.label())
            .center(geometryFactory.createPoint(new Coordinate(request.longitude(), request.latitude())))
            .radiusMeters(request.radiusMeters())
            .active(true)
            .build();

        GeofenceRegion saved = regionRepository.save(region);
        log.info("Created region id={} label={} for owner {}", saved.getId(), saved.getLabel(), saved.getOwnerId());
        refreshRegions();
        return saved;
    }

    /**
     * Soft-deletes a region.
     *
     * @return false if no active region has this id
     */
    @Transactional
    public boolean deleteRegion(Long regionId) {
        Optional<GeofenceRegion> found = regionRepository.findById(regionId)
            .filter(region -> Boolean.TRUE.equals(region.getActive()));
        if (found.isEmpty()) {
            return false;
        }
        GeofenceRegion region = found.get();
        region.setActive(false);
        regionRepository.save(region);
        log.info("Deactivated region id={}", regionId);
        refreshRegions();
        return true;
    }

    public List<GeofenceRegion> getRegions(String ownerId) {
        return ownerId != null
            ? regionRepository.findByOwnerIdAndActiveTrue(ownerId)
            : regionRepository.findByActiveTrue();
    }

    public List<GeofenceTransition> getRecentTransitions(Instant since) {
        return transitionRepository.findByOccurredAtAfterOrderByOccurredAtDesc(since);
    }

    public List<GeofenceTransition> getPeerTransitions(String peerId) {
        return transitionRepository.findByPeerIdOrderByOccurredAtDesc(peerId);
    }

    public List<GeofenceTransition> getRegionTransitions(Long regionId) {
        return transitionRepository.findByRegionIdOrderByOccurredAtDesc(regionId);
    }

    @Override
    public void onPeerPresenceChanged(PeerPresenceView changed, List<PeerPresenceView> allPeers) {
        evaluate(changed);
    }

    /**
     * Evaluates one peer view against the local user's regions.
     *
     * @return transitions detected for this view
     */
    public List<GeofenceTransitionRecord> evaluate(PeerPresenceView peer) {
        Optional<String> owner = presence.localUserId();
        if (owner.isEmpty() || !peer.hasLocation()) {
            return List.of();
        }

        LocationSample sample = peer.location();
        List<GeofenceTransitionRecord> transitions = new ArrayList<>();
        for (CachedRegionRecord region : regions) {
            if (!region.ownerId().equals(owner.get())) {
                continue;
            }
            String key = region.regionId() + "|" + peer.userId();
            Boolean wasInside = insideState.get(key);
            double distance = region.distanceTo(sample);

            if (region.isInside(distance)) {
                if (!Boolean.TRUE.equals(wasInside)) {
                    insideState.put(key, true);
                    transitions.add(record(region, peer.userId(), GeofenceTransitionType.ENTER, sample, distance));
                }
            } else if (Boolean.TRUE.equals(wasInside)) {
                if (region.isOutsideWithMargin(distance, sample.accuracyMeters())) {
                    insideState.put(key, false);
                    transitions.add(record(region, peer.userId(), GeofenceTransitionType.EXIT, sample, distance));
                }
            } else {
                insideState.put(key, false);
            }
        }
        return transitions;
    }

    private GeofenceTransitionRecord record(
        CachedRegionRecord region,
        String peerId,
        GeofenceTransitionType type,
        LocationSample sample,
        double distance
    ) {
        GeofenceTransitionRecord transition = GeofenceTransitionRecord.fromSample(region, peerId, type, sample, distance);
        log.info("Geofence transition: {}", transition.toLogString());
        notifications.geofenceTransition(transition);
        persistenceExecutor.execute(() -> persist(transition));
        return transition;
    }

    private void persist(GeofenceTransitionRecord transition) {
        GeofenceTransition entity = GeofenceTransition.builder()
            .transitionId(transition.transitionId())
            .regionId(transition.regionId())
            .regionLabel(transition.regionLabel())
            .peerId(transition.peerId())
            .type(transition.type())
            .latitude(transition.latitude())
            .longitude(transition.longitude())
            .distanceToCenter(transition.distanceToCenter())
            .occurredAt(transition.occurredAt())
            .build();
        try {
            transitionRepository.save(entity);
        } catch (DataAccessException e) {
            log.error("Failed to persist transition {}", transition.transitionId(), e);
        }
    }

    private static CachedRegionRecord toCached(GeofenceRegion region) {
        return new CachedRegionRecord(
            region.getId(),
            region.getOwnerId(),
            region.getLabel(),
            region.getLatitude(),
            region.getLongitude(),
            region.getRadiusMeters()
        );
    }
}

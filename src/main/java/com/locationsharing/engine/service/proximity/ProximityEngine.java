package com.locationsharing.engine.service.proximity;

import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.PeerPresenceView;
import com.locationsharing.engine.dto.ProximityEvent;
import com.locationsharing.engine.gateway.NotificationGateway;
import com.locationsharing.engine.service.presence.PeerPresenceListener;
import com.locationsharing.engine.service.presence.PresenceSubscription;
import com.locationsharing.engine.service.presence.PresenceSyncEngine;
import com.locationsharing.engine.service.sampling.LastKnownLocation;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raises "nearby" events when an online peer comes within the threshold.
 *
 * Rules, evaluated per peer on every change of any peer view or of the local fix:
 * - only peers that are online and expose a location are considered
 * - an event fires iff distance <= threshold and the pair has no active cooldown
 * - firing starts a cooldown for the pair
 * - distance > threshold clears the pair's cooldown, so a later re-entry notifies at once
 * - a peer that goes offline keeps its cooldown; it is cleared only by a
 *   measured separation or by expiry
 *
 * Cooldowns are in-memory and per device.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProximityEngine implements PeerPresenceListener {

    private final PresenceSyncEngine presence;
    private final LastKnownLocation lastKnownLocation;
    private final NotificationGateway notifications;
    private final ProximitySettings settings;
    private final Clock clock;

    private final Map<PairKey, Instant> cooldowns = new ConcurrentHashMap<>();
    private PresenceSubscription subscription;

    @PostConstruct
    public void subscribe() {
        subscription = presence.subscribeAll(this);
        lastKnownLocation.addListener(sample -> onPeerLocationsChanged(presence.peerViews()));
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.cancel();
        }
    }

    @Override
    public void onPeerPresenceChanged(PeerPresenceView changed, List<PeerPresenceView> allPeers) {
        onPeerLocationsChanged(allPeers);
    }

    /**
     * Evaluates every peer against the local fix.
     *
     * @return the events raised by this evaluation
     */
    public synchronized List<ProximityEvent> onPeerLocationsChanged(List<PeerPresenceView> peers) {
        Optional<LocationSample> self = lastKnownLocation.get();
        Optional<String> selfId = presence.localUserId();
        if (self.isEmpty() || selfId.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        List<ProximityEvent> raised = new ArrayList<>();
        for (PeerPresenceView peer : peers) {
            if (!peer.hasLocation() || peer.userId().equals(selfId.get())) {
                continue;
            }
            PairKey pairKey = PairKey.of(selfId.get(), peer.userId());
            LocationSample peerFix = peer.location();
            double distance = GeoDistance.meters(self.get(), peerFix);

            if (distance > settings.thresholdMeters()) {
                if (cooldowns.remove(pairKey) != null) {
                    log.debug("Pair {} separated ({}), proximity re-armed", pairKey, GeoDistance.formatDistance(distance));
                }
                continue;
            }
            if (isCoolingDown(pairKey, now)) {
                continue;
            }

            double bearing = GeoDistance.bearingDegrees(
                self.get().latitude(), self.get().longitude(), peerFix.latitude(), peerFix.longitude());
            ProximityEvent event = new ProximityEvent(
                peer.userId(),
                distance,
                bearing,
                GeoDistance.cardinalDirection(bearing),
                GeoDistance.formatDistance(distance),
                now
            );
            cooldowns.put(pairKey, now);
            raised.add(event);
            log.info("Peer nearby: {}", event.toLogString());
            notifications.proximity(event);
        }
        return raised;
    }

    public boolean hasActiveCooldown(String peerId) {
        return presence.localUserId()
            .map(selfId -> isCoolingDown(PairKey.of(selfId, peerId), clock.instant()))
            .orElse(false);
    }

    private boolean isCoolingDown(PairKey pairKey, Instant now) {
        Instant notifiedAt = cooldowns.get(pairKey);
        if (notifiedAt == null) {
            return false;
        }
        if (!now.isBefore(notifiedAt.plus(settings.cooldown()))) {
            cooldowns.remove(pairKey);
            return false;
        }
        return true;
    }

    /**
     * Order-independent key of a user pair.
     */
    record PairKey(String first, String second) {

        static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }

        @Override
        public String toString() {
            return first + "<->" + second;
        }
    }
}

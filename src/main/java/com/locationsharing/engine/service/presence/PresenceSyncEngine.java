package com.locationsharing.engine.service.presence;

import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.PeerPresenceView;
import com.locationsharing.engine.dto.PublishedPresence;
import com.locationsharing.engine.dto.TrackingHealth;
import com.locationsharing.engine.exception.MalformedPresenceException;
import com.locationsharing.engine.exception.PublishFailureException;
import com.locationsharing.engine.gateway.NotificationGateway;
import com.locationsharing.engine.gateway.PeerDirectory;
import com.locationsharing.engine.service.tracking.TrackingWorker;
import com.locationsharing.engine.service.tracking.TrackingWorker.ScheduledTask;
import com.locationsharing.engine.store.PresenceRecordCodec;
import com.locationsharing.engine.store.SharedLocationStore;
import com.locationsharing.engine.store.StoreChange;
import com.locationsharing.engine.store.StoreSubscription;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publishes the local user's presence and derives every peer's view of it.
 *
 * There is exactly one engine per process. It has two halves:
 *
 * Publisher:
 * - {@link #beginSharing(String)} writes an enabled record with a fresh heartbeat
 *   and starts the fixed-cadence heartbeat
 * - {@link #publish(LocationSample, boolean)} writes a new sample, or withdraws
 *   the location when sharing is disabled (one whole-record write, so the
 *   location fields disappear in the same write that clears the flag)
 * - writes are fire-and-forget on the tracking worker, retried with bounded
 *   exponential backoff and dropped once a newer record supersedes them
 * - while the device is offline only the newest record is kept and it is
 *   flushed when connectivity returns
 *
 * Subscriber:
 * - store change callbacks are re-dispatched onto the tracking worker
 * - records are decoded, older revisions ignored, malformed payloads discarded
 *   while the last good view is kept
 * - a periodic sweep re-derives every view, because a peer that stops sending
 *   produces no event at all; the viewer decides staleness
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceSyncEngine {

    private final SharedLocationStore store;
    private final PresenceRecordCodec codec;
    private final PeerDirectory peerDirectory;
    private final NotificationGateway notifications;
    private final TrackingWorker worker;
    private final Clock clock;
    private final PresenceSettings settings;

    private final Object publishLock = new Object();
    private volatile String localUserId;
    private volatile boolean sharingActive;
    private volatile PublishedPresence current;
    private long lastRevision;
    private ScheduledTask heartbeatTask = ScheduledTask.NONE;
    private boolean publishDeferred;
    private PublishedPresence deferredRecord;

    private final Map<String, PublishedPresence> peerRecords = new ConcurrentHashMap<>();
    private final Map<String, PeerPresenceView> peerViews = new ConcurrentHashMap<>();
    private final List<PeerPresenceListener> listeners = new CopyOnWriteArrayList<>();
    private final Object subscriptionLock = new Object();
    private StoreSubscription storeSubscription;
    private ScheduledTask sweepTask = ScheduledTask.NONE;

    // ---------------------------------------------------------------- publisher

    /**
     * Marks the local user as sharing and starts heartbeating.
     */
    public void beginSharing(String userId) {
        synchronized (publishLock) {
            localUserId = userId;
            sharingActive = true;
            PublishedPresence record = new PublishedPresence(
                userId, null, true, clock.instant(), TrackingHealth.TRACKING, nextRevision());
            write(record);

            heartbeatTask.cancel();
            heartbeatTask = worker.scheduleAtFixedRate(this::sendHeartbeat, settings.heartbeatInterval());
        }
        log.info("Presence sharing started for user {}", userId);
    }

    /**
     * Publishes a sample, or withdraws the published location.
     *
     * With {@code sharingEnabled == false} the sample is ignored and the record
     * is replaced by one without location. From the caller's perspective no
     * further location publish can happen after this returns.
     */
    public void publish(LocationSample sample, boolean sharingEnabled) {
        synchronized (publishLock) {
            String userId = localUserId;
            if (!sharingEnabled) {
                boolean wasSharing = sharingActive;
                sharingActive = false;
                heartbeatTask.cancel();
                heartbeatTask = ScheduledTask.NONE;
                if (userId != null && (wasSharing || current == null || current.sharingEnabled())) {
                    write(PublishedPresence.withdrawn(userId, clock.instant(), nextRevision()));
                    log.info("Presence sharing withdrawn for user {}", userId);
                }
                return;
            }

            if (!sharingActive || userId == null || sample == null) {
                log.debug("Ignoring publish while not sharing");
                return;
            }
            PublishedPresence record = current
                .withSample(sample, clock.instant(), nextRevision())
                .withTrackingHealth(TrackingHealth.TRACKING, clock.instant(), lastRevision);
            write(record);
        }
    }

    /**
     * Tells peers whether tracking currently produces fixes. A degraded user
     * stays online but their location is withheld.
     */
    public void reportTrackingHealth(TrackingHealth health) {
        synchronized (publishLock) {
            if (!sharingActive || current == null || current.trackingHealth() == health) {
                return;
            }
            write(current.withTrackingHealth(health, clock.instant(), nextRevision()));
            log.info("Tracking health of user {} reported as {}", localUserId, health);
        }
    }

    /**
     * Refreshes the liveness timestamp. Runs on a fixed cadence independent of
     * the sampling cadence.
     */
    public void sendHeartbeat() {
        synchronized (publishLock) {
            if (!sharingActive || current == null) {
                return;
            }
            write(current.withHeartbeat(clock.instant(), nextRevision()));
        }
    }

    /**
     * Withdraws sharing and removes the user's record from the store entirely.
     */
    public void signOut() {
        String userId = localUserId;
        publish(null, false);
        if (userId == null) {
            return;
        }
        worker.submit(() -> {
            try {
                store.remove(settings.keyFor(userId));
                log.info("Removed presence record of user {}", userId);
            } catch (PublishFailureException e) {
                log.warn("Failed to remove presence record of user {}: {}", userId, e.getMessage());
            }
        });
        synchronized (publishLock) {
            localUserId = null;
            current = null;
            deferredRecord = null;
        }
    }

    /**
     * Defers writes while the device has no connectivity. Turning deferral off
     * flushes the newest pending record.
     */
    public void setPublishDeferred(boolean deferred) {
        synchronized (publishLock) {
            if (publishDeferred == deferred) {
                return;
            }
            publishDeferred = deferred;
            log.info("Presence publishing {}", deferred ? "deferred until connectivity returns" : "resumed");
            if (!deferred && deferredRecord != null) {
                PublishedPresence pending = deferredRecord;
                deferredRecord = null;
                worker.submit(() -> attemptWrite(pending, 1));
            }
        }
    }

    public Optional<String> localUserId() {
        return Optional.ofNullable(localUserId);
    }

    public Optional<PublishedPresence> localPresence() {
        return Optional.ofNullable(current);
    }

    public boolean isSharing() {
        return sharingActive;
    }

    // Callers hold publishLock.
    private long nextRevision() {
        lastRevision = Math.max(clock.millis(), lastRevision + 1);
        return lastRevision;
    }

    // Callers hold publishLock.
    private void write(PublishedPresence record) {
        current = record;
        if (publishDeferred) {
            deferredRecord = record;
            log.debug("Publish deferred: {}", record.toLogString());
            return;
        }
        worker.submit(() -> attemptWrite(record, 1));
    }

    private void attemptWrite(PublishedPresence record, int attempt) {
        PublishedPresence latest = current;
        if (latest != null && latest.revision() > record.revision()) {
            log.debug("Dropping superseded presence revision {}", record.revision());
            return;
        }
        if (record.sharingEnabled() && !sharingActive) {
            log.debug("Dropping presence revision {}: sharing stopped", record.revision());
            return;
        }

        try {
            boolean accepted = store.put(settings.keyFor(record.userId()), codec.encode(record), record.revision());
            if (accepted) {
                log.debug("Published {}", record.toLogString());
            } else {
                log.debug("Store kept a newer record than revision {}", record.revision());
            }
        } catch (PublishFailureException e) {
            if (attempt >= settings.maxPublishAttempts()) {
                log.warn("Dropping presence revision {} after {} attempts: {}",
                    record.revision(), attempt, e.getMessage());
                return;
            }
            Duration delay = settings.retryBackoff(attempt);
            log.warn("Publish of revision {} failed (attempt {}), retrying in {}ms: {}",
                record.revision(), attempt, delay.toMillis(), e.getMessage());
            worker.schedule(() -> attemptWrite(record, attempt + 1), delay);
        }
    }

    // --------------------------------------------------------------- subscriber

    /**
     * Registers a listener for peer view changes. The first subscription
     * attaches to the store, loads the current record of every peer and starts
     * the staleness sweep.
     */
    public PresenceSubscription subscribeAll(PeerPresenceListener listener) {
        listeners.add(listener);
        synchronized (subscriptionLock) {
            if (storeSubscription == null) {
                storeSubscription = store.onValueChanged(settings.keyPrefix() + "*",
                    change -> worker.submit(() -> onStoreChange(change)));
                sweepTask = worker.scheduleAtFixedRate(this::sweepStaleness, settings.sweepInterval());
                worker.submit(this::loadPeers);
                log.info("Subscribed to presence of {} peers", peerDirectory.peers().size());
            }
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Immutable snapshot of every known peer view, sorted by user id.
     */
    public List<PeerPresenceView> peerViews() {
        return peerViews.values().stream()
            .sorted(Comparator.comparing(PeerPresenceView::userId))
            .toList();
    }

    public Optional<PeerPresenceView> peerView(String userId) {
        return Optional.ofNullable(peerViews.get(userId));
    }

    /**
     * Re-derives every peer view against the current time.
     */
    public void sweepStaleness() {
        Instant now = clock.instant();
        for (PublishedPresence record : peerRecords.values()) {
            updateView(record.userId(), PeerPresenceView.derive(record, now, settings.stalenessThreshold()));
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (subscriptionLock) {
            if (storeSubscription != null) {
                storeSubscription.cancel();
                storeSubscription = null;
            }
            sweepTask.cancel();
        }
        synchronized (publishLock) {
            heartbeatTask.cancel();
        }
    }

    private void loadPeers() {
        for (String peerId : peerDirectory.peers()) {
            store.get(settings.keyFor(peerId))
                .ifPresent(payload -> onStoreChange(new StoreChange(settings.keyFor(peerId), payload)));
        }
    }

    private void onStoreChange(StoreChange change) {
        if (!change.key().startsWith(settings.keyPrefix())) {
            return;
        }
        String userId = change.key().substring(settings.keyPrefix().length());
        if (userId.equals(localUserId) || !peerDirectory.isPeer(userId)) {
            return;
        }

        if (change.isRemoval()) {
            peerRecords.remove(userId);
            updateView(userId, PeerPresenceView.removed(userId));
            return;
        }

        PublishedPresence record;
        try {
            record = codec.decode(change.payload());
        } catch (MalformedPresenceException e) {
            log.warn("Discarding malformed presence update for {}: {}", userId, e.getMessage());
            return;
        }
        if (!record.userId().equals(userId)) {
            log.warn("Discarding presence update under key of {} written for {}", userId, record.userId());
            return;
        }

        PublishedPresence known = peerRecords.get(userId);
        if (known != null && record.revision() <= known.revision()) {
            log.debug("Ignoring out-of-order presence revision {} for {}", record.revision(), userId);
            return;
        }
        peerRecords.put(userId, record);
        updateView(userId, PeerPresenceView.derive(record, clock.instant(), settings.stalenessThreshold()));
    }

    private void updateView(String userId, PeerPresenceView view) {
        PeerPresenceView previous = peerViews.put(userId, view);
        if (view.equals(previous)) {
            return;
        }
        if (previous != null && previous.state() != view.state()) {
            log.info("Peer {} is now {}", userId, view.state());
        }

        notifications.peerPresence(view);
        List<PeerPresenceView> snapshot = peerViews();
        for (PeerPresenceListener listener : listeners) {
            try {
                listener.onPeerPresenceChanged(view, snapshot);
            } catch (RuntimeException e) {
                log.error("Peer presence listener failed for {}", userId, e);
            }
        }
    }
}

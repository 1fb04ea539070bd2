package com.locationsharing.engine.service.tracking;

import com.locationsharing.engine.dto.DeviceConditions;
import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.SamplingPolicy;
import com.locationsharing.engine.dto.TrackingHealth;
import com.locationsharing.engine.dto.TrackingPhase;
import com.locationsharing.engine.dto.TrackingStatus;
import com.locationsharing.engine.exception.AllStrategiesExhaustedException;
import com.locationsharing.engine.exception.PermissionDeniedException;
import com.locationsharing.engine.exception.ProviderUnavailableException;
import com.locationsharing.engine.exception.SampleTimeoutException;
import com.locationsharing.engine.exception.TrackingException;
import com.locationsharing.engine.gateway.DeviceCommandGateway;
import com.locationsharing.engine.gateway.NotificationGateway;
import com.locationsharing.engine.service.power.BatteryAdaptationPolicy;
import com.locationsharing.engine.service.power.DeviceConditionRegistry;
import com.locationsharing.engine.service.presence.PresenceSyncEngine;
import com.locationsharing.engine.service.proximity.GeoDistance;
import com.locationsharing.engine.service.sampling.LastKnownLocation;
import com.locationsharing.engine.service.sampling.SampleSubscription;
import com.locationsharing.engine.service.tracking.TrackingWorker.ScheduledTask;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Owns the tracking session and the ordered strategy list.
 *
 * State machine:
 * <pre>
 * IDLE -> STARTING(s_i) -> RUNNING(s_i) -> RECOVERING -> STARTING(s_i+1) ...
 *                                   \-> STOPPED (only on stop/sign-out or permission loss)
 * </pre>
 *
 * A strategy counts as started only once it produced a fix within the startup
 * timeout. Strategies that fail are skipped for a backoff window. While
 * running, a sampling cycle runs every policy interval (each bounded by the
 * sample timeout, never retried in a loop), and a periodic health check tears
 * the strategy down when its last fix is older than cadence times the
 * tolerance factor. The same check probes the best higher-priority strategy
 * whose backoff has expired and promotes it once it produces a fix within the
 * startup timeout. When every strategy has failed the session stays active,
 * peers are told there is no recent fix, and the start sequence is retried
 * with capped exponential backoff.
 *
 * All session state is confined to the tracking worker. Public methods hand
 * work over to it; only the session's active flag and the published status
 * are read across threads. Every asynchronous continuation carries the
 * generation it was started in and is ignored once the coordinator has moved on.
 * A start queued before a stop or sign-out is dropped when it reaches the worker.
 *
 * Sharing intent is remembered on start and cleared on stop and sign-out, so
 * {@link TrackingResumeService} can restart sharing after a process restart.
 */
@Slf4j
public class TrackingCoordinator {

    private static final Duration START_WAIT_MARGIN = Duration.ofSeconds(5);

    private final List<TrackingStrategy> strategies;
    private final BatteryAdaptationPolicy batteryPolicy;
    private final DeviceConditionRegistry deviceConditions;
    private final PresenceSyncEngine presence;
    private final LastKnownLocation lastKnownLocation;
    private final NotificationGateway notifications;
    private final DeviceCommandGateway deviceCommands;
    private final TrackingWorker worker;
    private final Clock clock;
    private final TrackingSettings settings;
    private final SharingIntentStore intents;

    private final AtomicLong stopRequests = new AtomicLong();
    private volatile TrackingSession session;
    private volatile TrackingStatus status;

    // Worker-confined state.
    private final Map<String, Instant> backoffUntil = new HashMap<>();
    private long generation;
    private TrackingPhase phase = TrackingPhase.IDLE;
    private SamplingPolicy policy;
    private SampleSubscription subscription;
    private ScheduledTask cycleTask = ScheduledTask.NONE;
    private ScheduledTask healthTask = ScheduledTask.NONE;
    private ScheduledTask retryTask = ScheduledTask.NONE;
    private int consecutiveTimeouts;
    private int exhaustedAttempts;
    private boolean degraded;
    private boolean exemptionRequested;
    private boolean promotionInFlight;
    private Instant lastFixReceivedAt;
    private LocationSample lastPublished;
    private Throwable lastFailure;
    private CompletableFuture<TrackingStatus> pendingStart;

    public TrackingCoordinator(
        List<TrackingStrategy> strategies,
        BatteryAdaptationPolicy batteryPolicy,
        DeviceConditionRegistry deviceConditions,
        PresenceSyncEngine presence,
        LastKnownLocation lastKnownLocation,
        NotificationGateway notifications,
        DeviceCommandGateway deviceCommands,
        TrackingWorker worker,
        Clock clock,
        TrackingSettings settings,
        SharingIntentStore intents
    ) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one tracking strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.batteryPolicy = batteryPolicy;
        this.deviceConditions = deviceConditions;
        this.presence = presence;
        this.lastKnownLocation = lastKnownLocation;
        this.notifications = notifications;
        this.deviceCommands = deviceCommands;
        this.worker = worker;
        this.clock = clock;
        this.settings = settings;
        this.intents = intents;
        this.status = snapshot(null, TrackingPhase.IDLE, null, "Not started");

        deviceConditions.addListener(this::onConditionsChanged);
    }

    // ------------------------------------------------------------------ public API

    /**
     * Starts sharing for {@code userId} and waits until tracking runs.
     *
     * @return the running status
     * @throws PermissionDeniedException       consent is missing; no strategy is tried
     * @throws AllStrategiesExhaustedException no strategy produced a fix; the session stays active and retries
     * @throws SampleTimeoutException          tracking did not settle within the bounded wait
     */
    public TrackingStatus start(String userId) {
        CompletableFuture<TrackingStatus> started = startAsync(userId);
        Duration wait = settings.startupTimeout().multipliedBy(strategies.size()).plus(START_WAIT_MARGIN);
        try {
            return started.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw asTrackingException(e.getCause());
        } catch (TimeoutException e) {
            throw new SampleTimeoutException(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SampleTimeoutException(wait);
        }
    }

    /**
     * Non-blocking variant of {@link #start(String)}. The future completes with
     * the running status, or exceptionally with the reason tracking could not start.
     */
    public CompletableFuture<TrackingStatus> startAsync(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        checkConsent();

        long stopsSoFar = stopRequests.get();
        intents.remember(userId);
        CompletableFuture<TrackingStatus> started = new CompletableFuture<>();
        worker.submit(() -> beginSession(userId, stopsSoFar, started));
        return started;
    }

    /**
     * Stops sharing. Safe from any state. Once this returns no further location
     * is published, even if a sampling cycle is in flight.
     */
    public void stop() {
        stop("Sharing disabled");
    }

    /**
     * Stops sharing and removes the user's presence record.
     */
    public void signOut() {
        stopRequests.incrementAndGet();
        intents.forget();
        TrackingSession current = session;
        if (current != null) {
            current.deactivate();
        }
        presence.signOut();
        status = snapshot(null, TrackingPhase.STOPPED, null, "Signed out");
        worker.submit(() -> {
            endSession(TrackingPhase.STOPPED, "Signed out");
            lastKnownLocation.clear();
        });
    }

    /**
     * Re-verifies that the active strategy still produces fixes.
     */
    public void onStrategyHealthCheck() {
        worker.submit(this::checkActiveStrategyHealth);
    }

    /**
     * Re-evaluates the battery policy for new device conditions.
     */
    public void onConditionsChanged(DeviceConditions conditions) {
        worker.submit(() -> applyConditions(conditions));
    }

    public TrackingStatus status() {
        return status;
    }

    public List<String> strategyNames() {
        return strategies.stream().map(TrackingStrategy::name).toList();
    }

    // --------------------------------------------------------------- session flow

    private void beginSession(String userId, long stopsAtRequest, CompletableFuture<TrackingStatus> started) {
        if (stopsAtRequest != stopRequests.get()) {
            log.info("Start for user {} dropped: sharing was stopped before it ran", userId);
            started.complete(status);
            return;
        }
        TrackingSession existing = session;
        if (existing != null && existing.isActive()) {
            if (existing.userId().equals(userId) && phase == TrackingPhase.RUNNING) {
                started.complete(status);
                return;
            }
            if (existing.userId().equals(userId) && pendingStart != null) {
                pendingStart.whenComplete((s, e) -> {
                    if (e != null) {
                        started.completeExceptionally(e);
                    } else {
                        started.complete(s);
                    }
                });
                return;
            }
            existing.deactivate();
            presence.publish(null, false);
            endSession(TrackingPhase.STOPPED, "Replaced by a new session");
        }

        TrackingSession created = new TrackingSession(userId, clock.instant());
        session = created;
        backoffUntil.clear();
        exhaustedAttempts = 0;
        degraded = false;
        exemptionRequested = false;
        lastPublished = null;
        lastFixReceivedAt = null;
        lastFailure = null;
        pendingStart = started;

        log.info("Tracking session started for user {} with strategies {}", userId, strategyNames());
        presence.beginSharing(userId);
        presence.setPublishDeferred(deviceConditions.current().isOffline());
        attemptNextStrategy("Sharing enabled");
    }

    private void attemptNextStrategy(String reason) {
        long attempt = ++generation;
        TrackingSession current = session;
        if (current == null || !current.isActive()) {
            return;
        }

        Instant now = clock.instant();
        List<TrackingStrategy> eligible = eligibleStrategies();
        if (eligible.isEmpty()) {
            failSession(new PermissionDeniedException("Background location consent is required by every remaining strategy"));
            return;
        }
        Optional<TrackingStrategy> next = eligible.stream()
            .filter(strategy -> !isBackingOff(strategy, now))
            .findFirst();
        if (next.isEmpty()) {
            onAllStrategiesExhausted();
            return;
        }

        TrackingStrategy strategy = next.get();
        current.setActiveStrategy(strategy);
        phase = TrackingPhase.STARTING;
        publishStatus(reason + "; starting " + strategy.name());

        if (!strategy.sampler().isAvailable()) {
            onStartFailure(strategy, new ProviderUnavailableException(
                "Provider '" + strategy.provider() + "' is not available"));
            return;
        }

        policy = batteryPolicy.evaluate(deviceConditions.current());
        requestFix(strategy, settings.startupTimeout(), attempt,
            sample -> onStartupFix(strategy, attempt, sample),
            error -> onStartFailure(strategy, error));
    }

    private void onStartupFix(TrackingStrategy strategy, long attempt, LocationSample sample) {
        acceptSample(sample);
        enterRunning(strategy, attempt);
    }

    private void onStartFailure(TrackingStrategy strategy, Throwable error) {
        if (error instanceof PermissionDeniedException denied) {
            failSession(denied);
            return;
        }
        log.warn("Strategy '{}' failed to start: {}", strategy.name(), error.getMessage());
        lastFailure = error;
        markFailed(strategy);
        attemptNextStrategy("Strategy " + strategy.name() + " failed: " + error.getMessage());
    }

    private void enterRunning(TrackingStrategy strategy, long attempt) {
        phase = TrackingPhase.RUNNING;
        consecutiveTimeouts = 0;
        exhaustedAttempts = 0;
        degraded = false;
        lastFixReceivedAt = clock.instant();
        presence.reportTrackingHealth(TrackingHealth.TRACKING);

        subscription = strategy.sampler().subscribe(policy,
            sample -> worker.submit(() -> onStreamedSample(attempt, sample)));
        scheduleNextCycle(attempt);
        healthTask.cancel();
        healthTask = worker.scheduleAtFixedRate(this::checkActiveStrategyHealth, settings.healthCheckInterval());
        requestExemptionIfRecommended();

        TrackingStatus running = publishStatus("Running " + strategy.name());
        log.info("Tracking running with strategy '{}' ({})", strategy.name(), policy.toLogString());
        if (pendingStart != null) {
            pendingStart.complete(running);
            pendingStart = null;
        }
    }

    private void scheduleNextCycle(long attempt) {
        cycleTask = worker.schedule(() -> runCycle(attempt), policy.sampleInterval());
    }

    private void runCycle(long attempt) {
        TrackingSession current = session;
        if (attempt != generation || phase != TrackingPhase.RUNNING || current == null) {
            return;
        }
        TrackingStrategy strategy = current.activeStrategy();
        requestFix(strategy, settings.sampleTimeout(), attempt,
            sample -> {
                consecutiveTimeouts = 0;
                acceptSample(sample);
                scheduleNextCycle(attempt);
            },
            error -> onCycleFailure(strategy, attempt, error));
    }

    private void onCycleFailure(TrackingStrategy strategy, long attempt, Throwable error) {
        if (error instanceof PermissionDeniedException denied) {
            failSession(denied);
        } else if (error instanceof ProviderUnavailableException) {
            failover(strategy, error);
        } else if (error instanceof SampleTimeoutException) {
            consecutiveTimeouts++;
            log.debug("Sampling cycle of '{}' timed out ({} in a row)", strategy.name(), consecutiveTimeouts);
            if (consecutiveTimeouts >= settings.maxConsecutiveTimeouts()) {
                failover(strategy, error);
            } else {
                scheduleNextCycle(attempt);
            }
        } else {
            log.warn("Sampling cycle of '{}' failed: {}", strategy.name(), error.getMessage());
            scheduleNextCycle(attempt);
        }
    }

    private void onStreamedSample(long attempt, LocationSample sample) {
        if (attempt != generation || phase != TrackingPhase.RUNNING) {
            return;
        }
        acceptSample(sample);
    }

    private void checkActiveStrategyHealth() {
        TrackingSession current = session;
        if (phase != TrackingPhase.RUNNING || current == null || !current.isActive()) {
            return;
        }
        Duration expected = policy.sampleInterval().multipliedBy(settings.cadenceToleranceFactor());
        Duration sinceLastFix = Duration.between(lastFixReceivedAt, clock.instant());
        if (sinceLastFix.compareTo(expected) > 0) {
            TrackingStrategy strategy = current.activeStrategy();
            failover(strategy, new SampleTimeoutException(strategy.provider(), sinceLastFix));
        } else {
            probeHigherPriorityStrategy(current);
        }
    }

    private void probeHigherPriorityStrategy(TrackingSession current) {
        if (promotionInFlight) {
            return;
        }
        TrackingStrategy active = current.activeStrategy();
        Instant now = clock.instant();
        Optional<TrackingStrategy> candidate = eligibleStrategies().stream()
            .takeWhile(strategy -> !strategy.name().equals(active.name()))
            .filter(strategy -> !isBackingOff(strategy, now))
            .filter(strategy -> strategy.sampler().isAvailable())
            .findFirst();
        if (candidate.isEmpty()) {
            return;
        }

        TrackingStrategy higher = candidate.get();
        promotionInFlight = true;
        log.info("Probing strategy '{}' while running on '{}'", higher.name(), active.name());
        requestFix(higher, settings.startupTimeout(), generation,
            sample -> promote(higher, sample),
            error -> {
                promotionInFlight = false;
                log.info("Strategy '{}' is still unavailable: {}", higher.name(), error.getMessage());
                markFailed(higher);
            });
    }

    private void promote(TrackingStrategy strategy, LocationSample sample) {
        TrackingSession current = session;
        if (current == null || !current.isActive()) {
            return;
        }
        log.info("Promoting strategy '{}' over '{}'", strategy.name(), current.activeStrategy().name());
        teardownRunning();
        backoffUntil.remove(strategy.name());
        current.setActiveStrategy(strategy);
        acceptSample(sample);
        enterRunning(strategy, generation);
    }

    private void failover(TrackingStrategy strategy, Throwable cause) {
        log.warn("Demoting strategy '{}': {}", strategy.name(), cause.getMessage());
        lastFailure = cause;
        markFailed(strategy);
        teardownRunning();
        phase = TrackingPhase.RECOVERING;
        publishStatus("Strategy " + strategy.name() + " unhealthy: " + cause.getMessage());
        attemptNextStrategy("Recovering");
    }

    private void onAllStrategiesExhausted() {
        exhaustedAttempts++;
        Duration retryIn = settings.exhaustedBackoff(exhaustedAttempts);
        TrackingSession current = session;
        current.setActiveStrategy(null);
        phase = TrackingPhase.RECOVERING;
        degraded = true;

        presence.reportTrackingHealth(TrackingHealth.NO_RECENT_FIX);
        String message = "All tracking strategies failed; retrying in " + retryIn.toSeconds() + "s";
        publishStatus(message);
        log.warn("{} (attempt {})", message, exhaustedAttempts);

        if (pendingStart != null) {
            pendingStart.completeExceptionally(new AllStrategiesExhaustedException(message, retryIn, lastFailure));
            pendingStart = null;
        }

        long attempt = generation;
        retryTask.cancel();
        retryTask = worker.schedule(() -> {
            if (attempt == generation && current.isActive()) {
                backoffUntil.clear();
                attemptNextStrategy("Retrying after backoff");
            }
        }, retryIn);
    }

    private void failSession(PermissionDeniedException denied) {
        log.error("Tracking stopped: {}", denied.getMessage());
        TrackingSession current = session;
        if (current != null) {
            current.deactivate();
        }
        presence.publish(null, false);
        if (pendingStart != null) {
            pendingStart.completeExceptionally(denied);
            pendingStart = null;
        }
        endSession(TrackingPhase.STOPPED, denied.getMessage());
    }

    private void stop(String reason) {
        stopRequests.incrementAndGet();
        intents.forget();
        TrackingSession current = session;
        if (current != null) {
            current.deactivate();
        }
        presence.publish(null, false);
        status = snapshot(current != null ? current.userId() : null, TrackingPhase.STOPPED, null, reason);
        worker.submit(() -> {
            endSession(TrackingPhase.STOPPED, reason);
            // withdraw again in case a session began after the synchronous withdrawal
            presence.publish(null, false);
            lastKnownLocation.clear();
        });
    }

    private void endSession(TrackingPhase finalPhase, String reason) {
        teardownRunning();
        retryTask.cancel();
        retryTask = ScheduledTask.NONE;
        backoffUntil.clear();

        TrackingSession current = session;
        phase = finalPhase;
        degraded = false;
        if (current != null) {
            current.setActiveStrategy(null);
        }
        TrackingStatus stopped = publishStatus(reason);
        if (pendingStart != null) {
            pendingStart.complete(stopped);
            pendingStart = null;
        }
        if (current != null) {
            log.info("Tracking session of user {} ended: {}", current.userId(), reason);
        }
        session = null;
    }

    private void teardownRunning() {
        generation++;
        promotionInFlight = false;
        cycleTask.cancel();
        cycleTask = ScheduledTask.NONE;
        healthTask.cancel();
        healthTask = ScheduledTask.NONE;
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    // ------------------------------------------------------------------ samples

    private void acceptSample(LocationSample sample) {
        TrackingSession current = session;
        if (current == null || !current.isActive()) {
            return;
        }
        if (!lastKnownLocation.update(sample)) {
            log.debug("Ignoring fix older than the last known one: {}", sample.toLogString());
            return;
        }
        lastFixReceivedAt = clock.instant();

        if (lastPublished == null
            || GeoDistance.meters(lastPublished, sample) >= policy.minDisplacementMeters()) {
            presence.publish(sample, true);
            lastPublished = sample;
        }
    }

    private void requestFix(
        TrackingStrategy strategy,
        Duration timeout,
        long attempt,
        Consumer<LocationSample> onFix,
        Consumer<Throwable> onFailure
    ) {
        CompletableFuture<LocationSample> fix = currentPosition(strategy, timeout);
        ScheduledTask timeoutTask = worker.schedule(
            () -> fix.completeExceptionally(new SampleTimeoutException(strategy.provider(), timeout)), timeout);

        fix.whenComplete((sample, error) -> worker.submit(() -> {
            timeoutTask.cancel();
            if (attempt != generation) {
                log.debug("Ignoring late result from '{}'", strategy.name());
                return;
            }
            if (error != null) {
                onFailure.accept(unwrap(error));
            } else {
                onFix.accept(sample);
            }
        }));
    }

    private CompletableFuture<LocationSample> currentPosition(TrackingStrategy strategy, Duration timeout) {
        try {
            return strategy.sampler().currentPosition(policy.accuracy(), timeout);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // ---------------------------------------------------------------- conditions

    private void applyConditions(DeviceConditions conditions) {
        presence.setPublishDeferred(conditions.isOffline());

        TrackingSession current = session;
        if (current == null || !current.isActive()) {
            return;
        }
        if (!conditions.foregroundLocationGranted()) {
            failSession(new PermissionDeniedException("Foreground location consent was revoked"));
            return;
        }
        TrackingStrategy strategy = current.activeStrategy();
        if (strategy != null && strategy.requiresBackgroundConsent() && !conditions.backgroundLocationGranted()) {
            failover(strategy, new PermissionDeniedException("Background location consent was revoked"));
            return;
        }
        if (phase != TrackingPhase.RUNNING) {
            return;
        }

        SamplingPolicy updated = batteryPolicy.evaluate(conditions);
        if (updated.equals(policy)) {
            return;
        }
        log.info("Sampling policy changed: {} -> {}", policy.toLogString(), updated.toLogString());
        policy = updated;
        long attempt = generation;
        if (subscription != null) {
            subscription.cancel();
        }
        subscription = strategy.sampler().subscribe(policy,
            sample -> worker.submit(() -> onStreamedSample(attempt, sample)));
        requestExemptionIfRecommended();
    }

    private void requestExemptionIfRecommended() {
        if (policy.exemptionRecommended() && !exemptionRequested) {
            exemptionRequested = true;
            deviceCommands.requestPowerExemption(batteryPolicy.powerManagementClass(deviceConditions.current()));
            log.info("Requested battery-optimisation exemption");
        }
    }

    private void checkConsent() {
        if (!deviceConditions.hasForegroundConsent()) {
            throw new PermissionDeniedException("Foreground location consent has not been granted");
        }
        if (eligibleStrategies().isEmpty()) {
            throw new PermissionDeniedException("Background location consent is required by every strategy");
        }
    }

    private List<TrackingStrategy> eligibleStrategies() {
        boolean background = deviceConditions.hasBackgroundConsent();
        return strategies.stream()
            .filter(strategy -> background || !strategy.requiresBackgroundConsent())
            .toList();
    }

    private boolean isBackingOff(TrackingStrategy strategy, Instant now) {
        Instant until = backoffUntil.get(strategy.name());
        return until != null && now.isBefore(until);
    }

    private void markFailed(TrackingStrategy strategy) {
        backoffUntil.put(strategy.name(), clock.instant().plus(settings.strategyBackoff()));
    }

    // ------------------------------------------------------------------- status

    private TrackingStatus publishStatus(String reason) {
        TrackingSession current = session;
        TrackingStrategy strategy = current != null ? current.activeStrategy() : null;
        TrackingStatus next = snapshot(
            current != null ? current.userId() : null,
            phase,
            strategy != null ? strategy.name() : null,
            reason);
        status = next;
        notifications.trackingStatus(next);
        log.info("Tracking {}: {}", next.phase(), reason);
        return next;
    }

    private TrackingStatus snapshot(String userId, TrackingPhase snapshotPhase, String strategyName, String reason) {
        TrackingSession current = session;
        return new TrackingStatus(
            userId,
            snapshotPhase,
            strategyName,
            degraded,
            current != null ? current.startedAt() : null,
            lastKnownLocation.get().map(LocationSample::capturedAt).orElse(null),
            reason,
            clock.instant()
        );
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static TrackingException asTrackingException(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TrackingException tracking) {
            return tracking;
        }
        return new ProviderUnavailableException("Tracking failed to start: " + cause.getMessage());
    }
}

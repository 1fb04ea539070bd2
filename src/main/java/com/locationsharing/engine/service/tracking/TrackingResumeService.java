package com.locationsharing.engine.service.tracking;

import com.locationsharing.engine.dto.DeviceConditions;
import com.locationsharing.engine.exception.PermissionDeniedException;
import com.locationsharing.engine.service.power.DeviceConditionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Restarts sharing after a process restart when the user had left it on.
 *
 * Device conditions are not known right after start-up, so when location
 * consent has not been reported yet the resume waits for the first report
 * that grants it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrackingResumeService {

    private final TrackingCoordinator coordinator;
    private final SharingIntentStore intents;
    private final DeviceConditionRegistry deviceConditions;

    private final AtomicReference<String> awaitingConsent = new AtomicReference<>();

    @EventListener(ApplicationReadyEvent.class)
    public void resumeSharing() {
        Optional<String> userId = intents.load();
        if (userId.isEmpty()) {
            log.info("No sharing to resume");
            return;
        }
        if (deviceConditions.hasForegroundConsent()) {
            resume(userId.get());
            return;
        }
        log.info("Sharing of user {} resumes once the device reports location consent", userId.get());
        awaitingConsent.set(userId.get());
        deviceConditions.addListener(this::onConditionsChanged);
    }

    private void onConditionsChanged(DeviceConditions conditions) {
        if (!conditions.foregroundLocationGranted()) {
            return;
        }
        String userId = awaitingConsent.getAndSet(null);
        if (userId == null) {
            return;
        }
        // sharing may have been switched off while waiting
        if (intents.load().filter(userId::equals).isPresent()) {
            resume(userId);
        }
    }

    private void resume(String userId) {
        log.info("Resuming location sharing for user {}", userId);
        try {
            coordinator.startAsync(userId).whenComplete((status, error) -> {
                if (error != null) {
                    log.warn("Resumed sharing of user {} has no running strategy yet: {}", userId, error.getMessage());
                } else {
                    log.info("Resumed sharing of user {}: {}", userId, status.phase());
                }
            });
        } catch (PermissionDeniedException e) {
            log.warn("Cannot resume sharing of user {}: {}", userId, e.getMessage());
        }
    }
}

package com.locationsharing.engine.service.tracking;

import com.locationsharing.engine.entity.SharingIntent;
import com.locationsharing.engine.repository.SharingIntentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * {@link SharingIntentStore} backed by the {@code sharing_intents} table.
 *
 * A database outage must not block starting or stopping tracking, so write
 * failures are logged and the toggle still takes effect for this process.
 */
@Slf4j
@Component
public class PersistentSharingIntentStore implements SharingIntentStore {

    private final SharingIntentRepository repository;
    private final String deviceKey;

    public PersistentSharingIntentStore(
        SharingIntentRepository repository,
        @Value("${location-sharing.device-key:local}") String deviceKey
    ) {
        this.repository = repository;
        this.deviceKey = deviceKey;
    }

    @Override
    public void remember(String userId) {
        try {
            repository.save(SharingIntent.builder()
                .deviceKey(deviceKey)
                .userId(userId)
                .sharingEnabled(true)
                .build());
            log.debug("Stored sharing intent for user {}", userId);
        } catch (DataAccessException e) {
            log.error("Failed to store sharing intent for user {}", userId, e);
        }
    }

    @Override
    public void forget() {
        try {
            repository.findById(deviceKey)
                .filter(intent -> Boolean.TRUE.equals(intent.getSharingEnabled()))
                .ifPresent(intent -> {
                    intent.setSharingEnabled(false);
                    repository.save(intent);
                    log.debug("Cleared sharing intent for user {}", intent.getUserId());
                });
        } catch (DataAccessException e) {
            log.error("Failed to clear sharing intent", e);
        }
    }

    @Override
    public Optional<String> load() {
        try {
            return repository.findById(deviceKey)
                .filter(intent -> Boolean.TRUE.equals(intent.getSharingEnabled()))
                .map(SharingIntent::getUserId);
        } catch (DataAccessException e) {
            log.error("Failed to load sharing intent", e);
            return Optional.empty();
        }
    }
}

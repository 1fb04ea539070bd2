package com.locationsharing.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.PublishedPresence;
import com.locationsharing.engine.dto.TrackingHealth;
import com.locationsharing.engine.exception.MalformedPresenceException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Converts {@link PublishedPresence} to and from its JSON store payload.
 */
@Component
@RequiredArgsConstructor
public class PresenceRecordCodec {

    private final ObjectMapper objectMapper;

    public String encode(PublishedPresence presence) {
        LocationSample sample = presence.lastSample();
        PresenceRecord record = new PresenceRecord(
            presence.userId(),
            presence.sharingEnabled(),
            sample != null ? sample.latitude() : null,
            sample != null ? sample.longitude() : null,
            sample != null ? sample.accuracyMeters() : null,
            sample != null ? sample.capturedAt().toEpochMilli() : null,
            sample != null ? sample.sourceProvider() : null,
            presence.lastHeartbeatAt().toEpochMilli(),
            presence.trackingHealth().name(),
            presence.revision()
        );
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode presence of " + presence.userId(), e);
        }
    }

    /**
     * @throws MalformedPresenceException if the payload is not a valid presence record
     */
    public PublishedPresence decode(String payload) {
        PresenceRecord record;
        try {
            record = objectMapper.readValue(payload, PresenceRecord.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPresenceException("Presence payload is not valid JSON", e);
        }

        if (record == null || record.userId() == null || record.userId().isBlank()) {
            throw new MalformedPresenceException("Presence payload has no userId");
        }
        if (record.lastHeartbeatEpochMs() == null || record.revision() == null) {
            throw new MalformedPresenceException("Presence payload of " + record.userId()
                + " is missing heartbeat or revision");
        }

        boolean sharing = Boolean.TRUE.equals(record.sharingEnabled());
        TrackingHealth health = parseHealth(record);

        try {
            return new PublishedPresence(
                record.userId(),
                sharing ? toSample(record) : null,
                sharing,
                Instant.ofEpochMilli(record.lastHeartbeatEpochMs()),
                health,
                record.revision()
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedPresenceException("Presence payload of " + record.userId()
                + " has invalid values: " + e.getMessage(), e);
        }
    }

    private LocationSample toSample(PresenceRecord record) {
        if (record.lat() == null && record.lng() == null) {
            return null;
        }
        if (record.lat() == null || record.lng() == null || record.capturedAtEpochMs() == null) {
            throw new MalformedPresenceException("Presence payload of " + record.userId()
                + " has a partial location");
        }
        return new LocationSample(
            record.lat(),
            record.lng(),
            record.accuracy() != null ? record.accuracy() : 0.0,
            Instant.ofEpochMilli(record.capturedAtEpochMs()),
            record.provider() != null ? record.provider() : "unknown"
        );
    }

    private TrackingHealth parseHealth(PresenceRecord record) {
        if (record.trackingStatus() == null) {
            return TrackingHealth.TRACKING;
        }
        try {
            return TrackingHealth.valueOf(record.trackingStatus());
        } catch (IllegalArgumentException e) {
            throw new MalformedPresenceException("Unknown tracking status '" + record.trackingStatus()
                + "' for " + record.userId(), e);
        }
    }
}

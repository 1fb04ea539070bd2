package com.locationsharing.engine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.PublishedPresence;
import com.locationsharing.engine.dto.TrackingHealth;
import com.locationsharing.engine.exception.MalformedPresenceException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PresenceRecordCodecTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final PresenceRecordCodec codec = new PresenceRecordCodec(new ObjectMapper());

    @Test
    void shouldEncodeSharingRecordWithLocation() {
        PublishedPresence presence = new PublishedPresence("alice",
            new LocationSample(52.52, 13.405, 12.0, NOW, "gps"), true, NOW, TrackingHealth.TRACKING, 42);

        String payload = codec.encode(presence);

        assertThat(payload)
            .contains("\"userId\":\"alice\"")
            .contains("\"lat\":52.52")
            .contains("\"capturedAtEpochMs\":" + NOW.toEpochMilli())
            .contains("\"revision\":42");
        assertThat(codec.decode(payload)).isEqualTo(presence);
    }

    @Test
    void shouldOmitLocationFieldsWhenNotSharing() {
        String payload = codec.encode(PublishedPresence.withdrawn("alice", NOW, 7));

        assertThat(payload)
            .contains("\"sharingEnabled\":false")
            .doesNotContain("lat")
            .doesNotContain("lng")
            .doesNotContain("accuracy")
            .doesNotContain("provider");
    }

    @Test
    void shouldDropLocationOfRecordThatIsNotSharing() {
        PublishedPresence decoded = codec.decode("{\"userId\":\"alice\",\"sharingEnabled\":false,\"lat\":1.0,"
            + "\"lng\":2.0,\"capturedAtEpochMs\":1,\"lastHeartbeatEpochMs\":5,\"revision\":5}");

        assertThat(decoded.lastSample()).isNull();
        assertThat(decoded.sharingEnabled()).isFalse();
    }

    @Test
    void shouldDefaultMissingTrackingStatusToTracking() {
        PublishedPresence decoded = codec.decode(
            "{\"userId\":\"alice\",\"sharingEnabled\":true,\"lastHeartbeatEpochMs\":5,\"revision\":5}");

        assertThat(decoded.trackingHealth()).isEqualTo(TrackingHealth.TRACKING);
        assertThat(decoded.lastSample()).isNull();
    }

    @Test
    void shouldRejectMalformedPayloads() {
        assertThatThrownBy(() -> codec.decode("not json"))
            .isInstanceOf(MalformedPresenceException.class);
        assertThatThrownBy(() -> codec.decode("{\"sharingEnabled\":true,\"lastHeartbeatEpochMs\":5,\"revision\":5}"))
            .isInstanceOf(MalformedPresenceException.class)
            .hasMessageContaining("userId");
        assertThatThrownBy(() -> codec.decode("{\"userId\":\"alice\",\"sharingEnabled\":true,\"revision\":5}"))
            .isInstanceOf(MalformedPresenceException.class);
        assertThatThrownBy(() -> codec.decode("{\"userId\":\"alice\",\"sharingEnabled\":true,\"lat\":1.0,"
            + "\"lastHeartbeatEpochMs\":5,\"revision\":5}"))
            .isInstanceOf(MalformedPresenceException.class)
            .hasMessageContaining("partial location");
        assertThatThrownBy(() -> codec.decode("{\"userId\":\"alice\",\"sharingEnabled\":true,\"lat\":123.0,"
            + "\"lng\":2.0,\"capturedAtEpochMs\":1,\"lastHeartbeatEpochMs\":5,\"revision\":5}"))
            .isInstanceOf(MalformedPresenceException.class);
        assertThatThrownBy(() -> codec.decode("{\"userId\":\"alice\",\"sharingEnabled\":true,"
            + "\"lastHeartbeatEpochMs\":5,\"revision\":5,\"trackingStatus\":\"LOST\"}"))
            .isInstanceOf(MalformedPresenceException.class);
    }
}

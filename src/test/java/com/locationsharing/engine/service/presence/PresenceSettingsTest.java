package com.locationsharing.engine.service.presence;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PresenceSettingsTest {

    @Test
    void shouldRejectHeartbeatSlowerThanHalfTheStalenessThreshold() {
        assertThatThrownBy(() -> new PresenceSettings(Duration.ofSeconds(70), Duration.ofSeconds(120),
            Duration.ofSeconds(10), Duration.ofSeconds(2), Duration.ofSeconds(30), 5, "presence/"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("twice the heartbeat interval");
    }

    @Test
    void shouldAcceptHeartbeatOfExactlyHalfTheThreshold() {
        PresenceSettings settings = new PresenceSettings(Duration.ofSeconds(60), Duration.ofSeconds(120),
            Duration.ofSeconds(10), Duration.ofSeconds(2), Duration.ofSeconds(30), 5, null);

        assertThat(settings.keyPrefix()).isEqualTo("presence/");
        assertThat(settings.keyFor("alice")).isEqualTo("presence/alice");
    }

    @Test
    void shouldCapRetryBackoff() {
        PresenceSettings settings = PresenceSettings.defaults();

        assertThat(settings.retryBackoff(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(settings.retryBackoff(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(settings.retryBackoff(8)).isEqualTo(Duration.ofSeconds(30));
    }
}

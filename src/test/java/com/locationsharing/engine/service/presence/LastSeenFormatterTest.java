package com.locationsharing.engine.service.presence;

import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.PeerPresenceView;
import com.locationsharing.engine.dto.PresenceState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LastSeenFormatterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldDescribeEachPresenceState() {
        LocationSample fix = new LocationSample(52.52, 13.405, 5.0, NOW, "gps");

        assertThat(LastSeenFormatter.format(
            new PeerPresenceView("bob", true, PresenceState.ONLINE, fix, NOW, NOW), NOW))
            .isEqualTo("Sharing location");
        assertThat(LastSeenFormatter.format(PeerPresenceView.removed("bob"), NOW))
            .isEqualTo("Not sharing");
        assertThat(LastSeenFormatter.format(
            new PeerPresenceView("bob", false, PresenceState.NO_RECENT_FIX, null, NOW, NOW.minus(Duration.ofMinutes(7))), NOW))
            .isEqualTo("No recent fix, location 7 min ago");
        assertThat(LastSeenFormatter.format(
            new PeerPresenceView("bob", false, PresenceState.OFFLINE, null, NOW.minus(Duration.ofHours(3)), null), NOW))
            .isEqualTo("Last seen 3 h ago");
    }

    @Test
    void shouldRoundAgesDown() {
        assertThat(LastSeenFormatter.ago(NOW.minusSeconds(30), NOW)).isEqualTo("just now");
        assertThat(LastSeenFormatter.ago(NOW.minusSeconds(119), NOW)).isEqualTo("1 min ago");
        assertThat(LastSeenFormatter.ago(NOW.minus(Duration.ofHours(30)), NOW)).isEqualTo("1 day ago");
        assertThat(LastSeenFormatter.ago(NOW.minus(Duration.ofDays(4)), NOW)).isEqualTo("4 days ago");
    }
}

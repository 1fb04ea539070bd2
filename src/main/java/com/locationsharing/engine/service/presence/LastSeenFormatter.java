package com.locationsharing.engine.service.presence;

import com.locationsharing.engine.dto.PeerPresenceView;

import java.time.Duration;
import java.time.Instant;

/**
 * Renders the "last seen" line shown next to a peer.
 */
public final class LastSeenFormatter {

    private LastSeenFormatter() {
    }

    public static String format(PeerPresenceView view, Instant now) {
        switch (view.state()) {
            case ONLINE:
                return "Sharing location";
            case NOT_SHARING:
                return "Not sharing";
            case NO_RECENT_FIX:
                return view.lastFixAt() != null
                    ? "No recent fix, location " + ago(view.lastFixAt(), now)
                    : "No recent fix";
            case OFFLINE:
            default:
                return view.lastHeartbeatAt() != null
                    ? "Last seen " + ago(view.lastHeartbeatAt(), now)
                    : "Offline";
        }
    }

    static String ago(Instant then, Instant now) {
        Duration age = Duration.between(then, now);
        if (age.isNegative() || age.toMinutes() < 1) {
            return "just now";
        }
        if (age.toHours() < 1) {
            return age.toMinutes() + " min ago";
        }
        if (age.toDays() < 1) {
            return age.toHours() + " h ago";
        }
        long days = age.toDays();
        return days == 1 ? "1 day ago" : days + " days ago";
    }
}

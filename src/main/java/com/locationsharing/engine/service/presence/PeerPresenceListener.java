package com.locationsharing.engine.service.presence;

import com.locationsharing.engine.dto.PeerPresenceView;

import java.util.List;

/**
 * Receives peer view changes, always on the tracking worker.
 */
@FunctionalInterface
public interface PeerPresenceListener {

    /**
     * @param changed  the view that changed
     * @param allPeers immutable snapshot of every known peer view, including {@code changed}
     */
    void onPeerPresenceChanged(PeerPresenceView changed, List<PeerPresenceView> allPeers);
}

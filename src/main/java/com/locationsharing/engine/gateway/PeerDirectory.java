package com.locationsharing.engine.gateway;

import java.util.Set;

/**
 * Read access to the social graph: which users the local user may see.
 */
public interface PeerDirectory {

    Set<String> peers();

    default boolean isPeer(String userId) {
        return peers().contains(userId);
    }
}

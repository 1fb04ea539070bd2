package com.locationsharing.engine.service.tracking;

import java.util.Optional;

/**
 * Remembers whether the user asked to share, so sharing resumes after the
 * process restarts. Cleared only by an explicit stop or sign-out.
 */
public interface SharingIntentStore {

    void remember(String userId);

    void forget();

    /**
     * @return the user whose sharing should be resumed, if any
     */
    Optional<String> load();
}

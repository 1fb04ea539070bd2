package com.locationsharing.engine.service.presence;

@FunctionalInterface
public interface PresenceSubscription {

    void cancel();
}

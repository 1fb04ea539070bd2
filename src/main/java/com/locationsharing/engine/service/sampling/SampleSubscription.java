package com.locationsharing.engine.service.sampling;

@FunctionalInterface
public interface SampleSubscription {

    void cancel();
}

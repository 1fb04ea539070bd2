package com.locationsharing.engine.store;

@FunctionalInterface
public interface StoreSubscription {

    void cancel();
}

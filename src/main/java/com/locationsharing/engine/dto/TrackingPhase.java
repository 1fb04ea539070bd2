package com.locationsharing.engine.dto;

/**
 * States of the tracking coordinator.
 *
 * Idle → Starting(i) → Running(i) → {Running(i) | Recovering → Starting(i+1)} → Stopped.
 * Stopped is only entered through an explicit stop.
 */
public enum TrackingPhase {
    IDLE,
    STARTING,
    RUNNING,
    RECOVERING,
    STOPPED
}

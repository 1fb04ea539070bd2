package com.locationsharing.engine.dto;

/**
 * How aggressively a manufacturer's power management kills background work.
 */
public enum PowerManagementClass {
    /** Stock platform behaviour. */
    STANDARD,
    /** Adds its own app standby rules on top of the platform. */
    MODERATE,
    /** Kills background services and delays alarms unless exempted. */
    AGGRESSIVE
}

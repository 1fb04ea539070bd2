package com.locationsharing.engine.dto;

/**
 * Desired fix accuracy requested from the platform positioning API.
 */
public enum AccuracyClass {
    HIGH,
    MEDIUM,
    LOW
}

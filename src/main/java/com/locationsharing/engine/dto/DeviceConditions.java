package com.locationsharing.engine.dto;

import java.util.Locale;

/**
 * Power, network and consent state reported by the sharing device.
 *
 * @param batteryLevel              battery percentage, 0-100
 * @param charging                  whether the device is on external power
 * @param powerSaveMode             whether the OS power-save mode is on
 * @param networkClass              current connectivity
 * @param manufacturer              device manufacturer, lower-cased
 * @param foregroundLocationGranted foreground location consent
 * @param backgroundLocationGranted background location consent
 */
public record DeviceConditions(
    int batteryLevel,
    boolean charging,
    boolean powerSaveMode,
    NetworkClass networkClass,
    String manufacturer,
    boolean foregroundLocationGranted,
    boolean backgroundLocationGranted
) {

    public DeviceConditions {
        if (batteryLevel < 0 || batteryLevel > 100) {
            throw new IllegalArgumentException("Battery level must be within [0, 100]: " + batteryLevel);
        }
        if (networkClass == null) {
            networkClass = NetworkClass.NONE;
        }
        manufacturer = manufacturer == null || manufacturer.isBlank()
            ? "unknown"
            : manufacturer.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Conditions assumed before the device has reported anything: full
     * battery, online, and no consent.
     */
    public static DeviceConditions unreported() {
        return new DeviceConditions(100, false, false, NetworkClass.WIFI, "unknown", false, false);
    }

    public boolean isOffline() {
        return networkClass == NetworkClass.NONE;
    }
}

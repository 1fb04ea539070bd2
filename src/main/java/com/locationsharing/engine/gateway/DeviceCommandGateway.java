package com.locationsharing.engine.gateway;

import com.locationsharing.engine.dto.AccuracyClass;
import com.locationsharing.engine.dto.PowerManagementClass;
import com.locationsharing.engine.dto.SamplingPolicy;

import java.time.Duration;

/**
 * Commands sent to the platform positioning adapter on the device.
 */
public interface DeviceCommandGateway {

    void requestSamplingUpdates(String provider, SamplingPolicy policy);

    void cancelSamplingUpdates(String provider);

    void requestSingleFix(String provider, AccuracyClass accuracy, Duration timeout);

    /**
     * Best effort: asks the device to prompt for a battery-optimisation exemption.
     */
    void requestPowerExemption(PowerManagementClass powerManagementClass);
}

package com.locationsharing.engine.service.power;

import com.locationsharing.engine.dto.AccuracyClass;
import com.locationsharing.engine.dto.DeviceConditions;
import com.locationsharing.engine.dto.PowerManagementClass;
import com.locationsharing.engine.dto.SamplingPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Maps device conditions to sampling parameters. Pure: no state, no side effects.
 *
 * Policy table:
 * <pre>
 * condition                       interval   displacement  accuracy
 * charging                        10-15s     5m            HIGH
 * battery >= 30%, no power save   15-30s     10m           HIGH
 * battery < 30% or power save     30-60s     25-50m        MEDIUM/LOW
 * no network                      unchanged; publishing deferred
 * </pre>
 *
 * Within a band the interval grows linearly as battery drops, so for a fixed
 * charging and power-save state lower battery never samples more often or more
 * accurately than higher battery. Devices whose manufacturer kills background
 * work aggressively sample at the fast end of each band and get an exemption
 * recommendation.
 */
@Component
@RequiredArgsConstructor
public class BatteryAdaptationPolicy {

    static final int LOW_BATTERY_PERCENT = 30;
    static final int CRITICAL_BATTERY_PERCENT = 15;

    private final PowerManagementProperties powerManagement;

    public SamplingPolicy evaluate(DeviceConditions conditions) {
        PowerManagementClass pmClass = powerManagement.classFor(conditions.manufacturer());
        boolean fastEnd = pmClass == PowerManagementClass.AGGRESSIVE;
        int level = conditions.batteryLevel();

        long intervalSeconds;
        double displacement;
        AccuracyClass accuracy;

        if (conditions.charging()) {
            intervalSeconds = fastEnd || level >= 50 ? 10 : 15;
            displacement = 5;
            accuracy = AccuracyClass.HIGH;
        } else if (level >= LOW_BATTERY_PERCENT && !conditions.powerSaveMode()) {
            intervalSeconds = fastEnd ? 15 : 15 + Math.round((100 - level) * 15 / 70.0);
            displacement = 10;
            accuracy = AccuracyClass.HIGH;
        } else {
            int effective = Math.min(level, LOW_BATTERY_PERCENT);
            intervalSeconds = fastEnd ? 30 : 30 + Math.round((LOW_BATTERY_PERCENT - effective) * 30.0 / LOW_BATTERY_PERCENT);
            boolean critical = level < CRITICAL_BATTERY_PERCENT;
            displacement = critical ? 50 : 25;
            accuracy = critical ? AccuracyClass.LOW : AccuracyClass.MEDIUM;
        }

        return new SamplingPolicy(
            Duration.ofSeconds(intervalSeconds),
            displacement,
            accuracy,
            conditions.isOffline(),
            pmClass != PowerManagementClass.STANDARD
        );
    }

    public PowerManagementClass powerManagementClass(DeviceConditions conditions) {
        return powerManagement.classFor(conditions.manufacturer());
    }
}

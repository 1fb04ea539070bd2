package com.locationsharing.engine.dto;

import java.time.Duration;

/**
 * Output of the battery adaptation policy, consulted before each sampling cycle.
 *
 * @param sampleInterval        time between sampling cycles
 * @param minDisplacementMeters movement required before a new fix is published
 * @param accuracy              accuracy requested from the positioning API
 * @param publishDeferred       sampling continues but publishing waits for connectivity
 * @param exemptionRecommended  ask the OS for a battery-optimisation exemption
 */
public record SamplingPolicy(
    Duration sampleInterval,
    double minDisplacementMeters,
    AccuracyClass accuracy,
    boolean publishDeferred,
    boolean exemptionRecommended
) {

    public String toLogString() {
        return String.format("Policy[interval=%ss, displacement=%.0fm, accuracy=%s, deferred=%s]",
            sampleInterval.toSeconds(), minDisplacementMeters, accuracy, publishDeferred);
    }
}

package com.locationsharing.engine.service.power;

import com.locationsharing.engine.dto.AccuracyClass;
import com.locationsharing.engine.dto.DeviceConditions;
import com.locationsharing.engine.dto.NetworkClass;
import com.locationsharing.engine.dto.PowerManagementClass;
import com.locationsharing.engine.dto.SamplingPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BatteryAdaptationPolicyTest {

    private final BatteryAdaptationPolicy policy = new BatteryAdaptationPolicy(new PowerManagementProperties(
        Map.of("oneplus", PowerManagementClass.AGGRESSIVE, "Samsung", PowerManagementClass.MODERATE),
        null));

    @Test
    void shouldNeverSampleMoreOftenAsBatteryDrops() {
        for (boolean charging : new boolean[]{true, false}) {
            for (boolean powerSave : new boolean[]{true, false}) {
                for (String manufacturer : new String[]{"google", "oneplus", "samsung"}) {
                    SamplingPolicy previous = null;
                    for (int level = 100; level >= 0; level--) {
                        SamplingPolicy current = policy.evaluate(conditions(level, charging, powerSave, manufacturer));
                        if (previous != null) {
                            assertThat(current.sampleInterval())
                                .as("level %d charging=%s powerSave=%s %s", level, charging, powerSave, manufacturer)
                                .isGreaterThanOrEqualTo(previous.sampleInterval());
                            assertThat(current.accuracy().ordinal())
                                .isGreaterThanOrEqualTo(previous.accuracy().ordinal());
                        }
                        previous = current;
                    }
                }
            }
        }
    }

    @Test
    void shouldSampleFastAndPreciseWhileCharging() {
        SamplingPolicy result = policy.evaluate(conditions(80, true, false, "google"));

        assertThat(result.sampleInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(result.minDisplacementMeters()).isEqualTo(5.0);
        assertThat(result.accuracy()).isEqualTo(AccuracyClass.HIGH);
    }

    @Test
    void shouldStayInNormalBandAboveThirtyPercent() {
        assertThat(policy.evaluate(conditions(100, false, false, "google")).sampleInterval())
            .isEqualTo(Duration.ofSeconds(15));
        assertThat(policy.evaluate(conditions(30, false, false, "google")).sampleInterval())
            .isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.evaluate(conditions(30, false, false, "google")).minDisplacementMeters())
            .isEqualTo(10.0);
    }

    @Test
    void shouldSaveBatteryWhenLowOrInPowerSaveMode() {
        SamplingPolicy low = policy.evaluate(conditions(20, false, false, "google"));
        SamplingPolicy critical = policy.evaluate(conditions(5, false, false, "google"));
        SamplingPolicy powerSave = policy.evaluate(conditions(90, false, true, "google"));

        assertThat(low.sampleInterval()).isBetween(Duration.ofSeconds(30), Duration.ofSeconds(60));
        assertThat(low.accuracy()).isEqualTo(AccuracyClass.MEDIUM);
        assertThat(low.minDisplacementMeters()).isEqualTo(25.0);
        assertThat(critical.accuracy()).isEqualTo(AccuracyClass.LOW);
        assertThat(critical.minDisplacementMeters()).isEqualTo(50.0);
        assertThat(powerSave.sampleInterval()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldDeferPublishingWithoutChangingCadenceWhenOffline() {
        DeviceConditions online = conditions(60, false, false, "google");
        DeviceConditions offline = new DeviceConditions(60, false, false, NetworkClass.NONE, "google", true, true);

        SamplingPolicy onlinePolicy = policy.evaluate(online);
        SamplingPolicy offlinePolicy = policy.evaluate(offline);

        assertThat(offlinePolicy.publishDeferred()).isTrue();
        assertThat(onlinePolicy.publishDeferred()).isFalse();
        assertThat(offlinePolicy.sampleInterval()).isEqualTo(onlinePolicy.sampleInterval());
    }

    @Test
    void shouldUseFastEndAndRecommendExemptionForAggressiveManufacturers() {
        SamplingPolicy aggressive = policy.evaluate(conditions(40, false, false, "OnePlus"));
        SamplingPolicy moderate = policy.evaluate(conditions(40, false, false, "samsung"));
        SamplingPolicy standard = policy.evaluate(conditions(40, false, false, "google"));

        assertThat(aggressive.sampleInterval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(aggressive.exemptionRecommended()).isTrue();
        assertThat(moderate.exemptionRecommended()).isTrue();
        assertThat(standard.exemptionRecommended()).isFalse();
        assertThat(policy.powerManagementClass(conditions(40, false, false, "SAMSUNG")))
            .isEqualTo(PowerManagementClass.MODERATE);
    }

    private static DeviceConditions conditions(int level, boolean charging, boolean powerSave, String manufacturer) {
        return new DeviceConditions(level, charging, powerSave, NetworkClass.WIFI, manufacturer, true, true);
    }
}

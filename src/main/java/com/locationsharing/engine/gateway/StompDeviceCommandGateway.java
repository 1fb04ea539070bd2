package com.locationsharing.engine.gateway;

import com.locationsharing.engine.dto.AccuracyClass;
import com.locationsharing.engine.dto.PowerManagementClass;
import com.locationsharing.engine.dto.SamplingPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Sends positioning commands to the device adapter on /topic/device-commands.
 *
 * Message shapes:
 * <pre>
 * {"type":"REQUEST_UPDATES","provider":"gps","intervalMs":15000,"minDisplacementMeters":10.0,"accuracy":"HIGH"}
 * {"type":"CANCEL_UPDATES","provider":"gps"}
 * {"type":"REQUEST_SINGLE_FIX","provider":"gps","accuracy":"HIGH","timeoutMs":15000}
 * {"type":"REQUEST_POWER_EXEMPTION","powerManagementClass":"AGGRESSIVE"}
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompDeviceCommandGateway implements DeviceCommandGateway {

    static final String DEVICE_COMMANDS_TOPIC = "/topic/device-commands";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    @Override
    public void requestSamplingUpdates(String provider, SamplingPolicy policy) {
        send(Map.of(
            "type", "REQUEST_UPDATES",
            "provider", provider,
            "intervalMs", policy.sampleInterval().toMillis(),
            "minDisplacementMeters", policy.minDisplacementMeters(),
            "accuracy", policy.accuracy().name(),
            "timestamp", clock.instant().toString()
        ));
    }

    @Override
    public void cancelSamplingUpdates(String provider) {
        send(Map.of(
            "type", "CANCEL_UPDATES",
            "provider", provider,
            "timestamp", clock.instant().toString()
        ));
    }

    @Override
    public void requestSingleFix(String provider, AccuracyClass accuracy, Duration timeout) {
        send(Map.of(
            "type", "REQUEST_SINGLE_FIX",
            "provider", provider,
            "accuracy", accuracy.name(),
            "timeoutMs", timeout.toMillis(),
            "timestamp", clock.instant().toString()
        ));
    }

    @Override
    public void requestPowerExemption(PowerManagementClass powerManagementClass) {
        send(Map.of(
            "type", "REQUEST_POWER_EXEMPTION",
            "powerManagementClass", powerManagementClass.name(),
            "timestamp", clock.instant().toString()
        ));
    }

    private void send(Map<String, Object> command) {
        try {
            messagingTemplate.convertAndSend(DEVICE_COMMANDS_TOPIC, command);
            log.debug("Sent device command {}", command.get("type"));
        } catch (MessagingException e) {
            log.warn("Failed to send device command {}: {}", command.get("type"), e.getMessage());
        }
    }
}

package com.locationsharing.engine.controller;

import com.locationsharing.engine.dto.DeviceStateMessage;
import com.locationsharing.engine.dto.LocationSample;
import com.locationsharing.engine.dto.LocationSampleMessage;
import com.locationsharing.engine.dto.ProviderStatusMessage;
import com.locationsharing.engine.service.power.DeviceConditionRegistry;
import com.locationsharing.engine.service.sampling.DeviceLocationFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.validation.annotation.Validated;

import java.security.Principal;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Inbound STOMP boundary from the device's platform positioning adapter.
 *
 * Message Flow:
 * 1. The adapter sends fixes to /app/location (or batches to /app/location/batch)
 * 2. Fixes are validated and routed to the sampler of their provider
 * 3. The tracking core picks them up on its worker
 *
 * Device state (/app/device-state) and provider status (/app/provider-status)
 * feed the battery policy, consent checks and strategy availability.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class DeviceStreamingController {

    private final DeviceLocationFeed deviceLocationFeed;
    private final DeviceConditionRegistry deviceConditionRegistry;
    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    @MessageMapping("/location")
    public void handleLocation(@Validated @Payload LocationSampleMessage message, Principal principal) {
        try {
            LocationSample sample = message.toSample();
            deviceLocationFeed.accept(sample);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected fix from device: {}", e.getMessage());
            if (principal != null) {
                messagingTemplate.convertAndSendToUser(principal.getName(), "/queue/errors", Map.of(
                    "status", "ERROR",
                    "message", "Invalid location fix",
                    "error", e.getMessage(),
                    "timestamp", clock.instant().toString()
                ));
            }
        }
    }

    @MessageMapping("/location/batch")
    public void handleLocationBatch(@Payload List<LocationSampleMessage> messages, Principal principal) {
        log.debug("Received batch of {} fixes", messages.size());
        messages.forEach(message -> handleLocation(message, principal));

        if (principal != null) {
            messagingTemplate.convertAndSendToUser(principal.getName(), "/queue/reply", Map.of(
                "status", "OK",
                "batchSize", messages.size(),
                "timestamp", clock.instant().toString()
            ));
        }
    }

    @MessageMapping("/device-state")
    public void handleDeviceState(@Validated @Payload DeviceStateMessage message) {
        deviceConditionRegistry.update(message.toConditions());
    }

    @MessageMapping("/provider-status")
    public void handleProviderStatus(@Validated @Payload ProviderStatusMessage message) {
        deviceLocationFeed.setProviderEnabled(message.provider().trim().toLowerCase(Locale.ROOT), message.enabled());
    }

    /**
     * Client sends ping, server responds with pong.
     */
    @MessageMapping("/ping")
    @SendToUser("/queue/reply")
    public Map<String, Object> handlePing(Principal principal) {
        log.debug("Ping received from {}", principal != null ? principal.getName() : "anonymous");
        return Map.of(
                "type", "PONG",
                "serverTime", clock.instant().toString(),
                "status", "OK"
        );
    }
}

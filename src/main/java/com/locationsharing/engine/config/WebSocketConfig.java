package com.locationsharing.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP link between the device's platform positioning adapter and the core.
 *
 * Endpoints:
 * - /ws/location-stream: WebSocket connection endpoint
 * - /app/*: device to core (fixes, device state, provider status, ping)
 * - /topic/*: core to device and UI (peers, proximity, geofence, tracking status, device commands)
 * - /user/queue/*: private replies (errors, batch acks, pings)
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${location-sharing.websocket.endpoint:/ws/location-stream}")
    private String websocketEndpoint;

    @Value("${location-sharing.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // user replies resolve to /queue/... session destinations
        config.enableSimpleBroker("/topic", "/queue");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // SockJS fallback for browser-based adapters
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}

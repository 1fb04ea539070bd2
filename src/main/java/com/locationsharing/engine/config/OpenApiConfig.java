package com.locationsharing.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI locationSharingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Real-Time Location Sharing API")
                        .description("Companion core that keeps a device's location shared with its peers.\n\n" +
                                "## Features\n\n" +
                                "- **Multi-strategy tracking** - ordered strategies with failover and health checks\n" +
                                "- **Battery adaptation** - sampling cadence follows power and network state\n" +
                                "- **Presence** - heartbeats and viewer-side staleness detection\n" +
                                "- **Proximity and geofences** - nearby-peer alerts with cooldown, region ENTER/EXIT\n\n" +
                                "## WebSocket Endpoints\n\n" +
                                "Connect to: `ws://localhost:" + serverPort + "/ws/location-stream`\n\n" +
                                "**Device to core:**\n" +
                                "- `/app/location` - single fix\n" +
                                "- `/app/location/batch` - batch of fixes\n" +
                                "- `/app/device-state` - battery, network, manufacturer, consent\n" +
                                "- `/app/provider-status` - provider switched on/off\n" +
                                "- `/app/ping` - health check\n\n" +
                                "**Core to device/UI:**\n" +
                                "- `/topic/peers`, `/topic/proximity`, `/topic/geofence`\n" +
                                "- `/topic/tracking-status`, `/topic/device-commands`")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local companion core")
                ));
    }
}

package com.locationsharing.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Real-Time Location Sharing core.
 *
 * One process runs per sharing device. The device's platform positioning
 * adapter streams fixes, device conditions and consent in over STOMP; the core
 * tracks, publishes presence to the shared store, derives peers' presence and
 * raises proximity and geofence events.
 *
 * @EnableScheduling drives maintenance jobs (region cache refresh). The
 * tracking cadence itself runs on the dedicated tracking worker.
 */
@SpringBootApplication
@EnableScheduling
public class LocationSharingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LocationSharingApplication.class, args);
    }
}

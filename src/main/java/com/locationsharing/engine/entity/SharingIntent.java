package com.locationsharing.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Sharing toggle of this device, kept across restarts.
 *
 * One row per device key; the row is updated rather than deleted when
 * sharing is switched off.
 */
@Entity
@Table(name = "sharing_intents")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SharingIntent {

    @Id
    @Column(name = "device_key", length = 100)
    private String deviceKey;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "sharing_enabled", nullable = false)
    private Boolean sharingEnabled;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}

package com.locationsharing.engine.service.power;

import com.locationsharing.engine.dto.PowerManagementClass;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Manufacturer power-management lookup table.
 *
 * Manufacturer workarounds are data, not code paths: each manufacturer maps
 * to a {@link PowerManagementClass} and the battery policy reads the class.
 *
 * <pre>
 * location-sharing:
 *   power-management:
 *     default-class: STANDARD
 *     manufacturers:
 *       oneplus: AGGRESSIVE
 *       samsung: MODERATE
 * </pre>
 */
@ConfigurationProperties(prefix = "location-sharing.power-management")
public record PowerManagementProperties(
    Map<String, PowerManagementClass> manufacturers,
    PowerManagementClass defaultClass
) {

    public PowerManagementProperties {
        manufacturers = manufacturers == null
            ? Map.of()
            : manufacturers.entrySet().stream().collect(Collectors.toUnmodifiableMap(
                e -> e.getKey().trim().toLowerCase(Locale.ROOT),
                Map.Entry::getValue));
        if (defaultClass == null) {
            defaultClass = PowerManagementClass.STANDARD;
        }
    }

    public PowerManagementClass classFor(String manufacturer) {
        if (manufacturer == null) {
            return defaultClass;
        }
        return manufacturers.getOrDefault(manufacturer.trim().toLowerCase(Locale.ROOT), defaultClass);
    }
}

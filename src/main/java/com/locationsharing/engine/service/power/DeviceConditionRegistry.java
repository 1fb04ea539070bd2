package com.locationsharing.engine.service.power;

import com.locationsharing.engine.dto.DeviceConditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Holds the latest conditions reported by the device and fans changes out to
 * listeners (policy re-evaluation, deferred publish flush).
 */
@Slf4j
@Component
public class DeviceConditionRegistry {

    private final AtomicReference<DeviceConditions> current =
        new AtomicReference<>(DeviceConditions.unreported());
    private final List<Consumer<DeviceConditions>> listeners = new CopyOnWriteArrayList<>();

    public DeviceConditions current() {
        return current.get();
    }

    public void update(DeviceConditions conditions) {
        DeviceConditions previous = current.getAndSet(conditions);
        if (conditions.equals(previous)) {
            return;
        }
        log.info("Device conditions changed: battery={}%, charging={}, powerSave={}, network={}, manufacturer={}",
            conditions.batteryLevel(), conditions.charging(), conditions.powerSaveMode(),
            conditions.networkClass(), conditions.manufacturer());
        for (Consumer<DeviceConditions> listener : listeners) {
            listener.accept(conditions);
        }
    }

    public void addListener(Consumer<DeviceConditions> listener) {
        listeners.add(listener);
    }

    public boolean hasForegroundConsent() {
        return current.get().foregroundLocationGranted();
    }

    public boolean hasBackgroundConsent() {
        return current.get().backgroundLocationGranted();
    }
}

package com.locationsharing.engine.service.sampling;

import com.locationsharing.engine.dto.LocationSample;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * The local user's last accepted fix.
 *
 * This is the only tracking state other components read. Samples are
 * immutable records, so handing out the reference is copy-on-read.
 */
@Component
public class LastKnownLocation {

    private final AtomicReference<LocationSample> current = new AtomicReference<>();
    private final List<Consumer<LocationSample>> listeners = new CopyOnWriteArrayList<>();

    public Optional<LocationSample> get() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Stores the sample if it is newer than the current one.
     *
     * @return true if the sample was stored
     */
    public boolean update(LocationSample sample) {
        LocationSample previous = current.getAndAccumulate(sample,
            (existing, incoming) -> incoming.isNewerThan(existing) ? incoming : existing);
        if (!sample.isNewerThan(previous)) {
            return false;
        }
        listeners.forEach(listener -> listener.accept(sample));
        return true;
    }

    public void clear() {
        current.set(null);
    }

    public void addListener(Consumer<LocationSample> listener) {
        listeners.add(listener);
    }
}

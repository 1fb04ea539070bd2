package com.locationsharing.engine.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Single-process {@link SharedLocationStore}. Listeners are called
 * synchronously on the writing thread.
 *
 * Enabled with {@code location-sharing.store.type=memory}; used for local
 * development and tests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "location-sharing.store.type", havingValue = "memory")
public class InMemorySharedLocationStore implements SharedLocationStore {

    private record Entry(String payload, long revision) {
    }

    private record Listener(String keyPattern, Consumer<StoreChange> callback) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public boolean put(String key, String payload, long revision) {
        boolean[] accepted = {false};
        entries.compute(key, (k, existing) -> {
            if (existing != null && existing.revision() >= revision) {
                return existing;
            }
            accepted[0] = true;
            return new Entry(payload, revision);
        });

        if (!accepted[0]) {
            log.debug("Rejected stale write: key={}, revision={}", key, revision);
            return false;
        }
        notifyListeners(new StoreChange(key, payload));
        return true;
    }

    @Override
    public void remove(String key) {
        if (entries.remove(key) != null) {
            notifyListeners(new StoreChange(key, null));
        }
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        return entry != null ? Optional.of(entry.payload()) : Optional.empty();
    }

    @Override
    public StoreSubscription onValueChanged(String keyPattern, Consumer<StoreChange> listener) {
        Listener registration = new Listener(keyPattern, listener);
        listeners.add(registration);
        return () -> listeners.remove(registration);
    }

    private void notifyListeners(StoreChange change) {
        for (Listener listener : listeners) {
            if (matches(listener.keyPattern(), change.key())) {
                listener.callback().accept(change);
            }
        }
    }

    static boolean matches(String pattern, String key) {
        if (pattern.endsWith("*")) {
            return key.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(key);
    }
}

package com.locationsharing.engine.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySharedLocationStoreTest {

    private final InMemorySharedLocationStore store = new InMemorySharedLocationStore();

    @Test
    void shouldRejectWritesWithOlderOrEqualRevision() {
        assertThat(store.put("presence/alice", "v2", 2)).isTrue();
        assertThat(store.put("presence/alice", "v1", 1)).isFalse();
        assertThat(store.put("presence/alice", "v2-again", 2)).isFalse();

        assertThat(store.get("presence/alice")).contains("v2");
    }

    @Test
    void shouldNotifyMatchingListenersOfAcceptedWritesAndRemovals() {
        List<StoreChange> changes = new ArrayList<>();
        store.onValueChanged("presence/*", changes::add);
        List<StoreChange> other = new ArrayList<>();
        store.onValueChanged("sessions/*", other::add);

        store.put("presence/alice", "v1", 1);
        store.put("presence/alice", "stale", 1);
        store.remove("presence/alice");
        store.remove("presence/alice");

        assertThat(changes).containsExactly(
            new StoreChange("presence/alice", "v1"),
            new StoreChange("presence/alice", null));
        assertThat(changes.get(1).isRemoval()).isTrue();
        assertThat(other).isEmpty();
    }

    @Test
    void shouldStopNotifyingCancelledSubscriptions() {
        List<StoreChange> changes = new ArrayList<>();
        StoreSubscription subscription = store.onValueChanged("presence/alice", changes::add);

        subscription.cancel();
        store.put("presence/alice", "v1", 1);

        assertThat(changes).isEmpty();
    }

    @Test
    void shouldMatchExactKeysAndSuffixWildcards() {
        assertThat(InMemorySharedLocationStore.matches("presence/*", "presence/bob")).isTrue();
        assertThat(InMemorySharedLocationStore.matches("presence/bob", "presence/bob")).isTrue();
        assertThat(InMemorySharedLocationStore.matches("presence/bob", "presence/bobby")).isFalse();
        assertThat(InMemorySharedLocationStore.matches("presence/*", "sessions/bob")).isFalse();
    }
}

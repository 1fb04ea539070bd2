package com.locationsharing.engine.service.tracking;

import com.locationsharing.engine.entity.SharingIntent;
import com.locationsharing.engine.repository.SharingIntentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PersistentSharingIntentStoreTest {

    private SharingIntentRepository repository;
    private PersistentSharingIntentStore store;

    @BeforeEach
    void setUp() {
        repository = mock(SharingIntentRepository.class);
        store = new PersistentSharingIntentStore(repository, "phone-1");
    }

    @Test
    void shouldStoreEnabledIntentUnderDeviceKey() {
        store.remember("alice");

        ArgumentCaptor<SharingIntent> saved = ArgumentCaptor.forClass(SharingIntent.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getDeviceKey()).isEqualTo("phone-1");
        assertThat(saved.getValue().getUserId()).isEqualTo("alice");
        assertThat(saved.getValue().getSharingEnabled()).isTrue();
    }

    @Test
    void shouldDisableStoredIntentOnForget() {
        SharingIntent intent = intent(true);
        when(repository.findById("phone-1")).thenReturn(Optional.of(intent));

        store.forget();

        assertThat(intent.getSharingEnabled()).isFalse();
        verify(repository).save(intent);
    }

    @Test
    void shouldNotWriteWhenNothingToForget() {
        when(repository.findById("phone-1")).thenReturn(Optional.empty());

        store.forget();

        verify(repository, never()).save(any());
    }

    @Test
    void shouldLoadUserOnlyWhileSharingIsEnabled() {
        when(repository.findById("phone-1")).thenReturn(Optional.of(intent(true)));
        assertThat(store.load()).contains("alice");

        when(repository.findById("phone-1")).thenReturn(Optional.of(intent(false)));
        assertThat(store.load()).isEmpty();
    }

    @Test
    void shouldTreatDatabaseFailuresAsNoIntent() {
        when(repository.findById("phone-1")).thenThrow(new DataAccessResourceFailureException("database down"));
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("database down"));

        assertThat(store.load()).isEmpty();
        assertThatCode(() -> store.remember("alice")).doesNotThrowAnyException();
        assertThatCode(store::forget).doesNotThrowAnyException();
    }

    private static SharingIntent intent(boolean enabled) {
        return SharingIntent.builder()
            .deviceKey("phone-1")
            .userId("alice")
            .sharingEnabled(enabled)
            .build();
    }
}

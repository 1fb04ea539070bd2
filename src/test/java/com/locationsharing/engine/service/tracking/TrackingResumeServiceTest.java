package com.locationsharing.engine.service.tracking;

import com.locationsharing.engine.dto.DeviceConditions;
import com.locationsharing.engine.dto.NetworkClass;
import com.locationsharing.engine.exception.PermissionDeniedException;
import com.locationsharing.engine.service.power.DeviceConditionRegistry;
import com.locationsharing.engine.support.InMemorySharingIntentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TrackingResumeServiceTest {

    private TrackingCoordinator coordinator;
    private InMemorySharingIntentStore intents;
    private DeviceConditionRegistry conditions;
    private TrackingResumeService resumeService;

    @BeforeEach
    void setUp() {
        coordinator = mock(TrackingCoordinator.class);
        when(coordinator.startAsync(anyString())).thenReturn(new CompletableFuture<>());
        intents = new InMemorySharingIntentStore();
        conditions = new DeviceConditionRegistry();
        resumeService = new TrackingResumeService(coordinator, intents, conditions);
    }

    @Test
    void shouldResumeStoredSharingWhenConsentIsKnown() {
        conditions.update(consented(80));
        intents.remember("alice");

        resumeService.resumeSharing();

        verify(coordinator).startAsync("alice");
    }

    @Test
    void shouldStayIdleWithoutStoredIntent() {
        conditions.update(consented(80));

        resumeService.resumeSharing();

        verify(coordinator, never()).startAsync(anyString());
    }

    @Test
    void shouldWaitForConsentBeforeResumingOnce() {
        intents.remember("alice");

        resumeService.resumeSharing();
        verify(coordinator, never()).startAsync(anyString());

        conditions.update(consented(80));
        conditions.update(consented(60));

        verify(coordinator, times(1)).startAsync("alice");
    }

    @Test
    void shouldNotResumeWhenSharingWasStoppedWhileWaitingForConsent() {
        intents.remember("alice");
        resumeService.resumeSharing();

        intents.forget();
        conditions.update(consented(80));

        verify(coordinator, never()).startAsync(anyString());
    }

    @Test
    void shouldSurviveConsentRejectionOnResume() {
        conditions.update(consented(80));
        intents.remember("alice");
        when(coordinator.startAsync("alice"))
            .thenThrow(new PermissionDeniedException("Background location consent is required by every strategy"));

        assertThatCode(resumeService::resumeSharing).doesNotThrowAnyException();
    }

    private static DeviceConditions consented(int battery) {
        return new DeviceConditions(battery, false, false, NetworkClass.WIFI, "google", true, true);
    }
}

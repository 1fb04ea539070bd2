package com.locationsharing.engine.service.tracking;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TrackingWorker} backed by a single-threaded Spring task scheduler.
 *
 * Every task is wrapped so that an exception is logged instead of silently
 * cancelling a periodic task.
 */
@Slf4j
@RequiredArgsConstructor
public class SchedulerTrackingWorker implements TrackingWorker {

    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;

    @Override
    public void submit(Runnable task) {
        scheduler.execute(guarded(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(guarded(task), clock.instant().plus(delay));
        return () -> future.cancel(false);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
            guarded(task), clock.instant().plus(period), period);
        return () -> future.cancel(false);
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Tracking worker task failed", e);
            }
        };
    }
}

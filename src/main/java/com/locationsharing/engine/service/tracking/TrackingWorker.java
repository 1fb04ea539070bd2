package com.locationsharing.engine.service.tracking;

import java.time.Duration;

/**
 * The single background execution context of the tracking core.
 *
 * Sample delivery, sampling cycles, health checks, heartbeats, staleness
 * sweeps and store callbacks are all dispatched here, so core state is only
 * ever touched from one thread. Tasks must not block on network I/O.
 */
public interface TrackingWorker {

    /**
     * Runs the task on the worker as soon as possible.
     */
    void submit(Runnable task);

    /**
     * Runs the task once after {@code delay}.
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Runs the task every {@code period}, first after one period.
     */
    ScheduledTask scheduleAtFixedRate(Runnable task, Duration period);

    /**
     * Handle to a scheduled task.
     */
    interface ScheduledTask {

        void cancel();

        ScheduledTask NONE = () -> { };
    }
}

package com.locationsharing.engine.support;

import com.locationsharing.engine.service.tracking.TrackingWorker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.PriorityQueue;

/**
 * Deterministic {@link TrackingWorker} driven by a {@link MutableClock}.
 *
 * Submitted tasks run on the calling thread before {@link #submit} returns;
 * tasks submitted while another task runs are queued behind it, as on the
 * real single-threaded worker. Scheduled tasks run only when a test calls
 * {@link #advance}, in due-time order. {@link #hold} keeps submitted tasks
 * queued until {@link #release}, to interleave callers with a busy worker.
 */
public class ManualTrackingWorker implements TrackingWorker {

    private final MutableClock clock;
    private final Deque<Runnable> ready = new ArrayDeque<>();
    private final PriorityQueue<Timer> timers = new PriorityQueue<>(
        Comparator.comparing((Timer t) -> t.due).thenComparingLong(t -> t.sequence));
    private long sequence;
    private boolean running;
    private boolean held;

    public ManualTrackingWorker(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void submit(Runnable task) {
        ready.add(task);
        drain();
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        Timer timer = new Timer(task, clock.instant().plus(delay), null, sequence++);
        timers.add(timer);
        return () -> timer.cancelled = true;
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        Timer timer = new Timer(task, clock.instant().plus(period), period, sequence++);
        timers.add(timer);
        return () -> timer.cancelled = true;
    }

    /**
     * Moves the clock forward, running every task that falls due on the way.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Timer next = timers.peek();
            if (next == null || next.due.isAfter(target)) {
                break;
            }
            timers.poll();
            if (next.cancelled) {
                continue;
            }
            if (next.due.isAfter(clock.instant())) {
                clock.setInstant(next.due);
            }
            if (next.period != null) {
                next.due = next.due.plus(next.period);
                next.sequence = sequence++;
                timers.add(next);
            }
            submit(next.task);
        }
        clock.setInstant(target);
        drain();
    }

    public void hold() {
        held = true;
    }

    public void release() {
        held = false;
        drain();
    }

    public int pendingTimers() {
        return (int) timers.stream().filter(t -> !t.cancelled).count();
    }

    private void drain() {
        if (running || held) {
            return;
        }
        running = true;
        try {
            Runnable task;
            while ((task = ready.poll()) != null) {
                task.run();
            }
        } finally {
            running = false;
        }
    }

    private static final class Timer {

        private final Runnable task;
        private final Duration period;
        private Instant due;
        private long sequence;
        private boolean cancelled;

        private Timer(Runnable task, Instant due, Duration period, long sequence) {
            this.task = task;
            this.due = due;
            this.period = period;
            this.sequence = sequence;
        }
    }
}

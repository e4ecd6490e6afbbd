package com.phillippitts.streamwatch.testutil;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} whose one-shot tasks run only when the test calls {@link #runDue(Instant)}.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final List<Task> tasks = new CopyOnWriteArrayList<>();

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        Task t = new Task(task, startTime);
        tasks.add(t);
        return t;
    }

    /**
     * Runs (and removes) every non-cancelled task due at or before {@code now}, including tasks
     * scheduled by the tasks being run.
     *
     * @return number of tasks run
     */
    public int runDue(Instant now) {
        int ran = 0;
        boolean progress = true;
        while (progress) {
            progress = false;
            for (Task t : new ArrayList<>(tasks)) {
                if (!t.startTime.isAfter(now)) {
                    tasks.remove(t);
                    if (!t.cancelled) {
                        t.run();
                        ran++;
                        progress = true;
                    }
                }
            }
        }
        return ran;
    }

    /**
     * @return tasks scheduled and not yet run or cancelled
     */
    public long pendingCount() {
        return tasks.stream().filter(t -> !t.cancelled).count();
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException();
    }

    static final class Task implements ScheduledFuture<Object> {
        private final Runnable runnable;
        private final Instant startTime;
        private volatile boolean cancelled;
        private volatile boolean done;

        Task(Runnable runnable, Instant startTime) {
            this.runnable = runnable;
            this.startTime = startTime;
        }

        void run() {
            try {
                runnable.run();
            } finally {
                done = true;
            }
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(Instant.now(), startTime));
        }

        @Override
        public int compareTo(Delayed o) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), o.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}

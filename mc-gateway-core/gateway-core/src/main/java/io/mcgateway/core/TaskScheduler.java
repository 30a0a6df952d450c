package io.mcgateway.core;

import java.time.Duration;

/**
 * Timer seam for heartbeats, reconnect backoff, query timeouts and sweeps. Production code runs on
 * {@link ExecutorTaskScheduler}; tests substitute a manually advanced implementation.
 */
public interface TaskScheduler extends AutoCloseable {
    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    @Override
    void close();

    @FunctionalInterface
    interface ScheduledTask {
        void cancel();
    }
}

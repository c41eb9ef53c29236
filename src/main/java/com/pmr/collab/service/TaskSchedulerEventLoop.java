package com.pmr.collab.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Event loop backed by a one-thread {@link ThreadPoolTaskScheduler}.
 */
@Slf4j
public class TaskSchedulerEventLoop implements SessionEventLoop {
    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;

    public TaskSchedulerEventLoop(String name, Clock clock) {
        this.clock = clock;
        this.scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(name + "-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(error -> log.error("Unhandled error on collaboration event loop", error));
        scheduler.initialize();
    }

    @Override
    public void execute(Runnable task) {
        scheduler.execute(task);
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(task, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public void shutdown() {
        scheduler.shutdown();
    }
}

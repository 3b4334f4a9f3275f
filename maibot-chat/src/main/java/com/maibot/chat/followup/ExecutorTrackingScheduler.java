package com.maibot.chat.followup;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TrackingScheduler} on a daemon {@link ScheduledExecutorService} and
 * the system clock.
 */
@Slf4j
public class ExecutorTrackingScheduler implements TrackingScheduler, AutoCloseable {

    private final ScheduledExecutorService scheduler;

    public ExecutorTrackingScheduler() {
        this(1);
    }

    public ExecutorTrackingScheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "follow-up-tracker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public long nowMs() {
        return System.currentTimeMillis();
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Follow-up task failed: {}", e.getMessage(), e);
            }
        }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}

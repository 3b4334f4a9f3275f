package com.maibot.chat.followup;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorTrackingSchedulerTest {

    private ExecutorTrackingScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    @Test
    void schedule_runsAfterDelay() throws Exception {
        scheduler = new ExecutorTrackingScheduler();
        var latch = new CountDownLatch(1);
        long before = scheduler.nowMs();

        scheduler.schedule(latch::countDown, 50);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(scheduler.nowMs() - before >= 40);
    }

    @Test
    void cancel_preventsRun() throws Exception {
        scheduler = new ExecutorTrackingScheduler();
        var counter = new AtomicInteger();

        TrackingScheduler.ScheduledTask task = scheduler.schedule(counter::incrementAndGet, 200);
        task.cancel();
        task.cancel();

        Thread.sleep(400);
        assertEquals(0, counter.get());
    }

    @Test
    void failingTask_doesNotKillScheduler() throws Exception {
        scheduler = new ExecutorTrackingScheduler();
        var latch = new CountDownLatch(1);

        scheduler.schedule(() -> {
            throw new IllegalStateException("boom");
        }, 0);
        scheduler.schedule(latch::countDown, 20);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    void close_shutsDown() {
        scheduler = new ExecutorTrackingScheduler(2);
        scheduler.close();
        assertTrue(scheduler.isShutdown());
    }
}

package com.maibot.chat.followup;

/**
 * Clock and delayed-task source for follow-up trackers.
 */
public interface TrackingScheduler {

    /** Current time in epoch milliseconds. */
    long nowMs();

    /**
     * Run {@code task} once after {@code delayMs}.
     */
    ScheduledTask schedule(Runnable task, long delayMs);

    /** Handle of a scheduled run. */
    @FunctionalInterface
    interface ScheduledTask {
        /** Prevent the run if it has not started. Idempotent. */
        void cancel();
    }
}

package com.maibot.chat.followup;

/**
 * The background loop owned by a {@link FollowUpTracker}.
 */
public interface TrackingTask {

    /** Stop the loop. Idempotent. */
    void cancel();

    boolean isCancelled();
}

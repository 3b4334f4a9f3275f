package com.maibot.chat.followup;

import com.maibot.chat.message.MessageRecv;
import com.maibot.chat.willing.WillingnessSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the follow-up trackers of all conversations, at most one per
 * conversation.
 * <p>
 * The message pipeline calls {@link #start} after the bot sends a reply and
 * {@link #feed} for every later inbound message. Each tracker is driven by a
 * polling loop on the injected {@link TrackingScheduler}; a loop that
 * finishes an evaluation only touches the registry if its tracker is still
 * the registered instance.
 */
@Slf4j
public class FollowUpManager {

    private final FollowUpSettings settings;
    private final NecessityEvaluator evaluator;
    private final WillingnessSink willingness;
    private final TrackingScheduler scheduler;

    private final Map<String, FollowUpTracker> trackers = new ConcurrentHashMap<>();
    private final Set<String> trackedAnchorIds = ConcurrentHashMap.newKeySet();

    public FollowUpManager(FollowUpSettings settings, NecessityEvaluator evaluator,
            WillingnessSink willingness, TrackingScheduler scheduler) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.willingness = Objects.requireNonNull(willingness, "willingness");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        log.info("Follow-up tracking {} (timeout: {}ms, max messages: {}, policy: {})",
                settings.enabled() ? "enabled" : "disabled",
                settings.timeoutMs(), settings.maxMessages(), settings.policy());
    }

    // -----------------------------------------------------------------------
    // Public operations
    // -----------------------------------------------------------------------

    /**
     * Open a follow-up window for a conversation, replacing any existing one.
     *
     * @param conversationId  chat stream id
     * @param anchorMessageId id of the bot message that opens the window
     */
    public void start(String conversationId, String anchorMessageId) {
        if (!settings.enabled() || conversationId == null) {
            return;
        }
        synchronized (this) {
            if (trackers.containsKey(conversationId)) {
                log.info("Replacing follow-up tracker of {}", conversationId);
                stop(conversationId);
            }
            FollowUpTracker tracker = new FollowUpTracker(conversationId, anchorMessageId,
                    settings, evaluator, willingness, scheduler::nowMs);
            trackers.put(conversationId, tracker);
            if (anchorMessageId != null) {
                trackedAnchorIds.add(anchorMessageId);
            }
            PollLoop loop = new PollLoop(tracker);
            if (!tracker.attach(loop) || !loop.scheduleTick()) {
                return;
            }
        }
        log.info("Started follow-up tracking of {} (anchor: {}, timeout: {}ms)",
                conversationId, anchorMessageId, settings.timeoutMs());
    }

    /**
     * Stop tracking a conversation. No-op when it is not tracked.
     */
    public synchronized void stop(String conversationId) {
        if (conversationId == null) {
            return;
        }
        FollowUpTracker tracker = trackers.get(conversationId);
        if (tracker == null) {
            return;
        }
        retire(tracker);
        log.debug("Stopped follow-up tracking of {}", conversationId);
    }

    /**
     * Stop every tracker, e.g. on shutdown.
     */
    public synchronized void stopAll() {
        List<FollowUpTracker> all = new ArrayList<>(trackers.values());
        for (FollowUpTracker tracker : all) {
            retire(tracker);
        }
        if (!all.isEmpty()) {
            log.info("Stopped {} follow-up tracker(s)", all.size());
        }
    }

    /**
     * Hand an inbound message to the conversation's tracker, if any.
     */
    public void feed(String conversationId, MessageRecv message) {
        if (!settings.enabled() || conversationId == null || message == null) {
            return;
        }
        FollowUpTracker tracker = trackers.get(conversationId);
        if (tracker == null || !tracker.isActive()) {
            return;
        }
        tracker.addMessage(message);
        if (log.isDebugEnabled()) {
            log.debug("Follow-up message for {} ({} collected): {}", conversationId,
                    tracker.getMessageCount(), abbreviate(message.getProcessedPlainText()));
        }
    }

    /**
     * Re-arm a conversation's window now: clear it, reset its start time and
     * replace its loop.
     *
     * @return false when the conversation has no active tracker or the
     *         scheduler refused the new loop
     */
    public synchronized boolean restartTracking(String conversationId) {
        FollowUpTracker tracker = conversationId != null ? trackers.get(conversationId) : null;
        if (tracker == null || !tracker.isActive()) {
            return false;
        }
        return rearm(tracker);
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    public boolean isTracking(String conversationId) {
        return conversationId != null && trackers.containsKey(conversationId);
    }

    /** Whether a bot message currently anchors a follow-up window. */
    public boolean isTrackedMessage(String messageId) {
        return messageId != null && trackedAnchorIds.contains(messageId);
    }

    /**
     * @return the registered tracker, or null
     */
    public FollowUpTracker getTracker(String conversationId) {
        return conversationId != null ? trackers.get(conversationId) : null;
    }

    public Set<String> getTrackedAnchorIds() {
        return Collections.unmodifiableSet(trackedAnchorIds);
    }

    public int activeCount() {
        return trackers.size();
    }

    public FollowUpSettings getSettings() {
        return settings;
    }

    // -----------------------------------------------------------------------
    // Loop bookkeeping
    // -----------------------------------------------------------------------

    /** Caller holds the manager lock. */
    private void retire(FollowUpTracker tracker) {
        tracker.deactivate();
        trackers.remove(tracker.getConversationId(), tracker);
        if (tracker.getAnchorMessageId() != null) {
            trackedAnchorIds.remove(tracker.getAnchorMessageId());
        }
    }

    /** Caller holds the manager lock. */
    private boolean rearm(FollowUpTracker tracker) {
        PollLoop next = new PollLoop(tracker);
        if (!tracker.restart(next) || !next.scheduleTick()) {
            return false;
        }
        log.debug("Restarted follow-up window of {}", tracker.getConversationId());
        return true;
    }

    private void onWindowClosed(FollowUpTracker tracker, PollLoop loop, TrackingOutcome outcome) {
        String conversationId = tracker.getConversationId();
        synchronized (this) {
            if (trackers.get(conversationId) != tracker) {
                log.debug("Follow-up tracker of {} was superseded, leaving registry untouched", conversationId);
                return;
            }
            if (tracker.getTask() != loop) {
                log.debug("Follow-up window of {} was re-armed meanwhile, outcome {} dropped", conversationId, outcome);
                return;
            }
            switch (outcome) {
                case SKIPPED -> {
                }
                case RESTART -> {
                    if (!rearm(tracker)) {
                        retire(tracker);
                    }
                }
                default -> {
                    retire(tracker);
                    log.debug("Cleaned up follow-up tracker of {} ({})", conversationId, outcome);
                }
            }
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 30 ? text.substring(0, 30) + "..." : text;
    }

    /**
     * Polls one tracker until its window closes, then runs the evaluation.
     */
    private final class PollLoop implements TrackingTask {

        private final FollowUpTracker tracker;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile TrackingScheduler.ScheduledTask nextTick;

        PollLoop(FollowUpTracker tracker) {
            this.tracker = tracker;
        }

        /**
         * @return false when the scheduler refused the tick; the tracker is
         *         retired in that case
         */
        boolean scheduleTick() {
            if (cancelled.get()) {
                return false;
            }
            try {
                nextTick = scheduler.schedule(this::tick, settings.pollIntervalMs());
                return true;
            } catch (RejectedExecutionException e) {
                log.warn("Scheduler rejected follow-up loop of {}, stop tracking: {}",
                        tracker.getConversationId(), e.getMessage());
                tracker.deactivate();
                onWindowClosed(tracker, this, TrackingOutcome.CLOSED);
                return false;
            }
        }

        private void tick() {
            if (cancelled.get()) {
                return;
            }
            try {
                if (tracker.shouldContinue()) {
                    scheduleTick();
                    return;
                }
                tracker.evaluateAndRespond().whenComplete((outcome, error) -> {
                    if (error != null) {
                        log.error("Follow-up evaluation of {} failed", tracker.getConversationId(), error);
                        tracker.deactivate();
                        onWindowClosed(tracker, this, TrackingOutcome.CLOSED);
                        return;
                    }
                    onWindowClosed(tracker, this, outcome);
                });
            } catch (RuntimeException e) {
                log.error("Follow-up loop of {} failed", tracker.getConversationId(), e);
                tracker.deactivate();
                onWindowClosed(tracker, this, TrackingOutcome.CLOSED);
            }
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                TrackingScheduler.ScheduledTask pending = nextTick;
                if (pending != null) {
                    pending.cancel();
                }
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}

package com.maibot.chat.followup;

import com.maibot.chat.message.MessageRecv;
import com.maibot.chat.willing.WillingnessSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

/**
 * Observation window of one conversation after the bot spoke.
 * <p>
 * Collects follow-up messages until the window times out or fills up, then
 * asks the {@link NecessityEvaluator} whether they need a reply. Instances are
 * created and retired by {@link FollowUpManager} only.
 * <p>
 * While an evaluation is in flight the judged messages are frozen; messages
 * arriving meanwhile are held back and open the next window if the tracker is
 * re-armed.
 */
@Slf4j
public class FollowUpTracker {

    enum State {
        COLLECTING,
        EVALUATING,
        TERMINATED
    }

    private final String conversationId;
    private final String anchorMessageId;
    private final FollowUpSettings settings;
    private final NecessityEvaluator evaluator;
    private final WillingnessSink willingness;
    private final LongSupplier clock;

    private List<MessageRecv> collected = new ArrayList<>();
    private List<MessageRecv> heldBack = new ArrayList<>();
    private long windowStartMs;
    private State state = State.COLLECTING;
    private int restartCount;
    /** Bumped on every re-arm; ties a verdict to the window it judged. */
    private long window;
    private TrackingTask task;

    FollowUpTracker(String conversationId, String anchorMessageId, FollowUpSettings settings,
            NecessityEvaluator evaluator, WillingnessSink willingness, LongSupplier clock) {
        this.conversationId = conversationId;
        this.anchorMessageId = anchorMessageId;
        this.settings = settings;
        this.evaluator = evaluator;
        this.willingness = willingness;
        this.clock = clock;
        this.windowStartMs = clock.getAsLong();
    }

    /**
     * Append a follow-up message. Dropped silently once the tracker is
     * inactive.
     */
    public synchronized void addMessage(MessageRecv message) {
        if (message == null) {
            return;
        }
        switch (state) {
            case COLLECTING -> collected.add(message);
            case EVALUATING -> heldBack.add(message);
            default -> log.trace("Dropped follow-up message for inactive tracker {}", conversationId);
        }
    }

    /**
     * Whether the window is still open: active, not timed out and not full.
     */
    public synchronized boolean shouldContinue() {
        if (state != State.COLLECTING) {
            return false;
        }
        return !windowExhausted();
    }

    private boolean windowExhausted() {
        return clock.getAsLong() - windowStartMs >= settings.timeoutMs()
                || collected.size() >= settings.maxMessages();
    }

    /**
     * Mark the tracker dead and cancel its loop. Idempotent.
     */
    public synchronized void deactivate() {
        if (state == State.TERMINATED) {
            return;
        }
        state = State.TERMINATED;
        heldBack = new ArrayList<>();
        if (task != null) {
            task.cancel();
        }
    }

    /**
     * Close the current window: judge the collected messages and decide
     * whether to reply, re-arm or stop. Never completes exceptionally.
     */
    public CompletableFuture<TrackingOutcome> evaluateAndRespond() {
        List<MessageRecv> snapshot;
        long judgedWindow;
        synchronized (this) {
            if (state == State.TERMINATED) {
                return CompletableFuture.completedFuture(TrackingOutcome.CLOSED);
            }
            if (state == State.EVALUATING) {
                return CompletableFuture.completedFuture(TrackingOutcome.SKIPPED);
            }
            if (collected.isEmpty()) {
                log.debug("Follow-up window of {} closed with no messages", conversationId);
                deactivate();
                return CompletableFuture.completedFuture(TrackingOutcome.CLOSED);
            }
            snapshot = List.copyOf(collected);
            judgedWindow = window;
            state = State.EVALUATING;
        }

        String context = ConversationContext.build(snapshot);
        CompletableFuture<Boolean> verdict;
        try {
            verdict = evaluator.evaluate(conversationId, context);
            if (verdict == null) {
                verdict = CompletableFuture.completedFuture(false);
            }
        } catch (RuntimeException e) {
            verdict = CompletableFuture.failedFuture(e);
        }

        return verdict
                .exceptionally(e -> {
                    log.warn("Follow-up judge failed for {}: {}", conversationId, e.getMessage());
                    return false;
                })
                .thenApply(necessary -> decide(Boolean.TRUE.equals(necessary), snapshot.size(), judgedWindow));
    }

    private TrackingOutcome decide(boolean necessary, int judged, long judgedWindow) {
        synchronized (this) {
            if (state == State.TERMINATED) {
                log.debug("Tracker {} stopped while being judged, verdict ignored", conversationId);
                return TrackingOutcome.CLOSED;
            }
            if (state != State.EVALUATING || judgedWindow != window) {
                log.debug("Window of {} was re-armed while being judged, verdict ignored", conversationId);
                return TrackingOutcome.SKIPPED;
            }
            if (!necessary) {
                if (settings.allowsRestart(restartCount)) {
                    restartCount++;
                    log.debug("No reply needed for {} ({} messages), keep tracking", conversationId, judged);
                    return TrackingOutcome.RESTART;
                }
                log.debug("No reply needed for {} ({} messages), stop tracking", conversationId, judged);
                deactivate();
                return TrackingOutcome.CLOSED;
            }
            deactivate();
        }
        log.info("Follow-up reply wanted for {} after {} messages", conversationId, judged);
        try {
            willingness.setWilling(conversationId, settings.replyWillingness());
        } catch (RuntimeException e) {
            log.error("Failed to raise willingness for {}", conversationId, e);
        }
        return TrackingOutcome.WILL_REPLY;
    }

    /**
     * Re-arm the window: new start time, held-back messages become the new
     * window, {@code next} replaces the current loop.
     *
     * @return false if the tracker is inactive
     */
    synchronized boolean restart(TrackingTask next) {
        if (state == State.TERMINATED) {
            return false;
        }
        window++;
        windowStartMs = clock.getAsLong();
        collected = heldBack;
        heldBack = new ArrayList<>();
        state = State.COLLECTING;
        replaceTask(next);
        return true;
    }

    /**
     * Install the first loop of a fresh tracker.
     */
    synchronized boolean attach(TrackingTask first) {
        if (state == State.TERMINATED) {
            return false;
        }
        replaceTask(first);
        return true;
    }

    private void replaceTask(TrackingTask next) {
        if (task != null && task != next) {
            task.cancel();
        }
        task = next;
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public String getConversationId() {
        return conversationId;
    }

    public String getAnchorMessageId() {
        return anchorMessageId;
    }

    public synchronized boolean isActive() {
        return state != State.TERMINATED;
    }

    public synchronized boolean isEvaluating() {
        return state == State.EVALUATING;
    }

    public synchronized long getWindowStartMs() {
        return windowStartMs;
    }

    public synchronized int getRestartCount() {
        return restartCount;
    }

    /** Messages of the current window, in arrival order. */
    public synchronized List<MessageRecv> getCollected() {
        return List.copyOf(collected);
    }

    public synchronized int getMessageCount() {
        return collected.size();
    }

    synchronized TrackingTask getTask() {
        return task;
    }
}

package com.maibot.chat.followup;

import com.maibot.common.config.MaiBotConfig;

/**
 * Runtime view of the {@code followUp} config section.
 *
 * @param enabled          global switch; when off start and feed do nothing
 * @param timeoutMs        window length
 * @param maxMessages      message count that closes the window early
 * @param pollIntervalMs   how often a window is re-checked
 * @param policy           behaviour after a negative verdict
 * @param maxRestarts      re-arm budget per tracker, negative for unlimited
 * @param replyWillingness willingness set after a positive verdict
 */
public record FollowUpSettings(
        boolean enabled,
        long timeoutMs,
        int maxMessages,
        long pollIntervalMs,
        FollowUpPolicy policy,
        int maxRestarts,
        double replyWillingness) {

    static final long MIN_POLL_INTERVAL_MS = 10;

    public FollowUpSettings {
        timeoutMs = Math.max(0, timeoutMs);
        maxMessages = Math.max(1, maxMessages);
        pollIntervalMs = Math.max(MIN_POLL_INTERVAL_MS, pollIntervalMs);
        policy = policy != null ? policy : FollowUpPolicy.RESTART;
    }

    public static FollowUpSettings from(MaiBotConfig.FollowUpConfig config) {
        if (config == null) {
            config = new MaiBotConfig.FollowUpConfig();
        }
        return new FollowUpSettings(
                config.isEnabled(),
                Math.round(config.getTimeoutSeconds() * 1000),
                config.getMaxMessages(),
                config.getPollIntervalMs(),
                FollowUpPolicy.parse(config.getPolicy()),
                config.getMaxRestarts(),
                config.getReplyWillingness());
    }

    public static FollowUpSettings defaults() {
        return from(new MaiBotConfig.FollowUpConfig());
    }

    /**
     * Whether a tracker that has already been re-armed {@code restartsSoFar}
     * times may be re-armed again.
     */
    public boolean allowsRestart(int restartsSoFar) {
        if (policy == FollowUpPolicy.CLOSE) {
            return false;
        }
        return maxRestarts < 0 || restartsSoFar < maxRestarts;
    }
}

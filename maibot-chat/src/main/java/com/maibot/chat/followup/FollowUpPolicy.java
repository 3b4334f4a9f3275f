package com.maibot.chat.followup;

import java.util.Locale;

/**
 * What a tracker does after the judge decides no reply is needed.
 */
public enum FollowUpPolicy {
    /** Clear the window and keep listening. */
    RESTART,
    /** Stop tracking after the first evaluation. */
    CLOSE;

    /**
     * Parse a config value, falling back to {@link #RESTART}.
     */
    public static FollowUpPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return RESTART;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "close", "close-always", "once" -> CLOSE;
            default -> RESTART;
        };
    }
}

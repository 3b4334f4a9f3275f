package com.maibot.chat.followup;

/**
 * Result of closing a follow-up window.
 */
public enum TrackingOutcome {
    /** Window closed without asking for a reply. */
    CLOSED,
    /** The judge asked for a reply; willingness was raised. */
    WILL_REPLY,
    /** Negative verdict, the window is re-armed in place. */
    RESTART,
    /** The evaluation no longer applies to the tracker's current window. */
    SKIPPED;

    public boolean isTerminal() {
        return this == CLOSED || this == WILL_REPLY;
    }
}

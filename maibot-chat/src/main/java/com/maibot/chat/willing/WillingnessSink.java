package com.maibot.chat.willing;

/**
 * Receives per-conversation reply-willingness updates.
 */
@FunctionalInterface
public interface WillingnessSink {

    void setWilling(String conversationId, double value);
}

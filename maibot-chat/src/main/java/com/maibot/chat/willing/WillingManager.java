package com.maibot.chat.willing;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory reply willingness per conversation. Reply selection reads it to
 * decide whether the next inbound message gets answered.
 */
@Slf4j
public class WillingManager implements WillingnessSink {

    private final Map<String, Double> willing = new ConcurrentHashMap<>();

    @Override
    public void setWilling(String conversationId, double value) {
        if (conversationId == null) {
            return;
        }
        willing.put(conversationId, value);
        log.debug("Willingness of {} set to {}", conversationId, value);
    }

    /**
     * @return current willingness, 0 when never set
     */
    public double getWilling(String conversationId) {
        if (conversationId == null) {
            return 0;
        }
        return willing.getOrDefault(conversationId, 0.0);
    }

    public void resetWilling(String conversationId) {
        if (conversationId != null) {
            willing.remove(conversationId);
        }
    }
}

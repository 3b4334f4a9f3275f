package com.maibot.chat.followup;

import java.util.concurrent.CompletableFuture;

/**
 * Judges whether the follow-up messages of a conversation call for a reply.
 * The future may complete exceptionally; callers treat that as "no".
 */
@FunctionalInterface
public interface NecessityEvaluator {

    /**
     * @param conversationId conversation the context belongs to
     * @param context        one {@code sender: text} line per message, in order
     * @return true when a reply is warranted
     */
    CompletableFuture<Boolean> evaluate(String conversationId, String context);
}
